package net.cronkeeper.adapter.jdbc.mapper;

import net.cronkeeper.adapter.jdbc.JdbcUtil;
import net.cronkeeper.core.model.*;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- ScheduledJob ---
    public static ScheduledJob toScheduledJob(ResultSet rs) throws SQLException {
        var template = new JobTemplate(
                JsonColumns.stringMap(rs.getString("TEMPLATE_LABELS")),
                JsonColumns.stringMap(rs.getString("TEMPLATE_ANNOTATIONS")),
                rs.getString("TEMPLATE_BODY"));
        var spec = new ScheduledJobSpec(
                rs.getString("SCHEDULE"),
                JdbcUtil.getLong(rs, "STARTING_DEADLINE_SECONDS"),
                ConcurrencyPolicy.from(rs.getString("CONCURRENCY_POLICY")),
                JdbcUtil.yn(rs.getString("SUSPEND")),
                template,
                JdbcUtil.getInt(rs, "SUCCESSFUL_HISTORY_LIMIT"),
                JdbcUtil.getInt(rs, "FAILED_HISTORY_LIMIT"));
        var status = new ScheduledJobStatus(
                JsonColumns.refs(rs.getString("STATUS_ACTIVE")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_SCHEDULE_TIME")));
        return new ScheduledJob(
                ObjectKey.of(rs.getString("NAMESPACE"), rs.getString("NAME")),
                rs.getString("OBJ_UID"),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getLong("RESOURCE_VERSION"),
                spec,
                status);
    }

    // --- ChildJob ---
    public static ChildJob toChildJob(ResultSet rs) throws SQLException {
        OwnerRef owner = null;
        String ownerUid = rs.getString("OWNER_UID");
        if (ownerUid != null) {
            owner = new OwnerRef(
                    rs.getString("OWNER_API_GROUP"),
                    rs.getString("OWNER_KIND"),
                    rs.getString("OWNER_NAME"),
                    ownerUid,
                    JdbcUtil.yn(rs.getString("OWNER_CONTROLLER")));
        }
        return new ChildJob(
                ObjectKey.of(rs.getString("NAMESPACE"), rs.getString("NAME")),
                rs.getString("OBJ_UID"),
                JsonColumns.stringMap(rs.getString("LABELS")),
                JsonColumns.stringMap(rs.getString("ANNOTATIONS")),
                rs.getString("BODY"),
                owner,
                JsonColumns.conditions(rs.getString("CONDITIONS")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("START_TIME")),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETION_TIME")));
    }
}
