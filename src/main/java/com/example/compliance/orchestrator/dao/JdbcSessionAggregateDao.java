package com.example.compliance.orchestrator.dao;

import com.example.compliance.orchestrator.model.OperationTally;
import com.example.compliance.orchestrator.model.ResultTally;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSessionAggregateDao implements SessionAggregateDao {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public OperationTally tallyOperations(long sessionId) {
        final String sql = """
                select count(*) as total,
                       coalesce(sum(case when status = 'completed' then 1 else 0 end), 0) as completed,
                       coalesce(sum(case when status = 'failed' then 1 else 0 end), 0) as failed
                from indexing_operations
                where session_id = ?
                """;

        OperationTally tally = jdbcTemplate.queryForObject(sql,
                (rs, rowNum) -> new OperationTally(
                        rs.getInt("total"),
                        rs.getInt("completed"),
                        rs.getInt("failed")),
                sessionId);
        return tally == null ? OperationTally.empty() : tally;
    }

    @Override
    public ResultTally tallyResults(long sessionId) {
        final String sql = """
                select count(*) as observed,
                       coalesce(sum(case when status = 'met' then 1 else 0 end), 0) as met,
                       coalesce(sum(case when status = 'partial' then 1 else 0 end), 0) as partial,
                       coalesce(sum(case when status = 'not-met' then 1 else 0 end), 0) as not_met
                from requirement_results
                where session_id = ?
                """;

        ResultTally tally = jdbcTemplate.queryForObject(sql,
                (rs, rowNum) -> new ResultTally(
                        rs.getInt("observed"),
                        rs.getInt("met"),
                        rs.getInt("partial"),
                        rs.getInt("not_met")),
                sessionId);
        return tally == null ? ResultTally.empty() : tally;
    }
}
