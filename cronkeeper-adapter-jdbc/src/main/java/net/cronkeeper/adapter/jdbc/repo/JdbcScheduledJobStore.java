package net.cronkeeper.adapter.jdbc.repo;

import net.cronkeeper.adapter.jdbc.JdbcUtil;
import net.cronkeeper.adapter.jdbc.TxContext;
import net.cronkeeper.adapter.jdbc.mapper.JsonColumns;
import net.cronkeeper.adapter.jdbc.mapper.RowMappers;
import net.cronkeeper.core.model.ChildJob;
import net.cronkeeper.core.model.ObjectKey;
import net.cronkeeper.core.model.OwnerRef;
import net.cronkeeper.core.model.ScheduledJob;
import net.cronkeeper.core.model.ScheduledJobSpec;
import net.cronkeeper.core.service.OwnerIndex;
import net.cronkeeper.core.service.ReconcilerConfig;
import net.cronkeeper.core.spi.AlreadyExistsException;
import net.cronkeeper.core.spi.Clock;
import net.cronkeeper.core.spi.ConflictException;
import net.cronkeeper.core.spi.DeletePropagation;
import net.cronkeeper.core.spi.NotFoundException;
import net.cronkeeper.core.spi.ScheduledJobStore;
import net.cronkeeper.core.spi.StoreException;
import net.cronkeeper.core.spi.TxRunner;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * TB_SCHEDULED_JOB / TB_CHILD_JOB 위의 선언형 스토어.
 * 호출마다 TxRunner.required 로 감싸고, 모든 문장에 queryTimeout 을 건다.
 * 자식 Job 은 종속 객체가 없으므로 삭제 전파 방식과 무관하게 행만 지운다.
 */
public final class JdbcScheduledJobStore implements ScheduledJobStore {
    private static final int ORA_UNIQUE_VIOLATION = 1; // ORA-00001

    private final TxRunner tx;
    private final ReconcilerConfig config;
    private final Clock clock;
    private final int queryTimeoutSeconds;

    public JdbcScheduledJobStore(TxRunner tx, ReconcilerConfig config, Clock clock, Duration queryTimeout) {
        this.tx = tx;
        this.config = config;
        this.clock = clock;
        this.queryTimeoutSeconds = (int) Math.max(1, queryTimeout.toSeconds());
    }

    @Override
    public Optional<ScheduledJob> get(ObjectKey key) throws StoreException {
        return inTx("get " + key, () -> findScheduledJob(key));
    }

    @Override
    public List<ChildJob> listChildJobs(String namespace, String indexKey, String ownerName) throws StoreException {
        if (!config.ownerIndexKey().equals(indexKey)) {
            throw new StoreException("no index registered for field '" + indexKey + "'");
        }
        return inTx("list children of " + namespace + "/" + ownerName, () -> {
            try (PreparedStatement ps = prepare("""
                    SELECT *
                      FROM TB_CHILD_JOB
                     WHERE NAMESPACE = ?
                       AND OWNER_INDEX = ?
                     ORDER BY NAME
                    """)) {
                ps.setString(1, namespace);
                ps.setString(2, ownerName);
                try (ResultSet rs = ps.executeQuery()) {
                    List<ChildJob> out = new ArrayList<>();
                    while (rs.next()) out.add(RowMappers.toChildJob(rs));
                    return out;
                }
            }
        });
    }

    @Override
    public ChildJob create(ChildJob job) throws StoreException {
        return inTx("create " + job.key(), () -> {
            String uid = UUID.randomUUID().toString();
            Instant now = clock.now();
            OwnerRef owner = job.owner();
            try (PreparedStatement ps = prepare("""
                    INSERT INTO TB_CHILD_JOB
                        (NAMESPACE, NAME, OBJ_UID, LABELS, ANNOTATIONS, BODY,
                         OWNER_API_GROUP, OWNER_KIND, OWNER_NAME, OWNER_UID, OWNER_CONTROLLER, OWNER_INDEX,
                         CONDITIONS, START_TIME, COMPLETION_TIME, CREATED_AT)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                    """)) {
                int i = 1;
                ps.setString(i++, job.key().namespace());
                ps.setString(i++, job.key().name());
                ps.setString(i++, uid);
                ps.setString(i++, JsonColumns.write(job.labels()));
                ps.setString(i++, JsonColumns.write(job.annotations()));
                ps.setString(i++, job.body());
                ps.setString(i++, owner == null ? null : owner.apiGroup());
                ps.setString(i++, owner == null ? null : owner.kind());
                ps.setString(i++, owner == null ? null : owner.name());
                ps.setString(i++, owner == null ? null : owner.uid());
                ps.setString(i++, JdbcUtil.yn(owner != null && owner.controller()));
                ps.setString(i++, OwnerIndex.indexValue(job, config).orElse(null));
                ps.setString(i++, JsonColumns.write(job.conditions()));
                ps.setTimestamp(i++, JdbcUtil.ts(job.startTime()));
                ps.setTimestamp(i++, JdbcUtil.ts(job.completionTime()));
                ps.setTimestamp(i++, JdbcUtil.ts(now));
                ps.executeUpdate();
            }
            return new ChildJob(job.key(), uid, job.labels(), job.annotations(), job.body(), owner,
                    job.conditions(), now, job.startTime(), job.completionTime());
        });
    }

    @Override
    public ScheduledJob updateStatus(ScheduledJob job) throws StoreException {
        return inTx("update status of " + job.key(), () -> {
            int updated;
            try (PreparedStatement ps = prepare("""
                    UPDATE TB_SCHEDULED_JOB
                       SET STATUS_ACTIVE      = ?,
                           LAST_SCHEDULE_TIME = ?,
                           RESOURCE_VERSION   = RESOURCE_VERSION + 1,
                           UPDATED_AT         = ?
                     WHERE NAMESPACE = ?
                       AND NAME = ?
                       AND RESOURCE_VERSION = ?
                    """)) {
                ps.setString(1, JsonColumns.write(job.status().active()));
                ps.setTimestamp(2, JdbcUtil.ts(job.status().lastScheduleTime()));
                ps.setTimestamp(3, JdbcUtil.ts(clock.now()));
                ps.setString(4, job.namespace());
                ps.setString(5, job.name());
                ps.setLong(6, job.resourceVersion());
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                // 행이 없으면 NotFound, 있으면 다른 쪽이 먼저 갱신한 것
                if (findScheduledJob(job.key()).isEmpty()) {
                    throw new NotFoundException("scheduled job " + job.key() + " not found");
                }
                throw new ConflictException("scheduled job " + job.key()
                        + " was modified (resourceVersion " + job.resourceVersion() + " is stale)");
            }
            return findScheduledJob(job.key())
                    .orElseThrow(() -> new NotFoundException("scheduled job " + job.key() + " vanished"));
        });
    }

    @Override
    public void delete(ChildJob job, DeletePropagation propagation) throws StoreException {
        inTx("delete " + job.key(), () -> {
            try (PreparedStatement ps = prepare("DELETE FROM TB_CHILD_JOB WHERE NAMESPACE = ? AND NAME = ?")) {
                ps.setString(1, job.key().namespace());
                ps.setString(2, job.key().name());
                if (ps.executeUpdate() == 0) {
                    throw new NotFoundException("job " + job.key() + " not found");
                }
            }
            return null;
        });
    }

    @Override
    public List<ScheduledJob> listScheduledJobs() throws StoreException {
        return inTx("list scheduled jobs", () -> {
            try (PreparedStatement ps = prepare("SELECT * FROM TB_SCHEDULED_JOB ORDER BY NAMESPACE, NAME");
                 ResultSet rs = ps.executeQuery()) {
                List<ScheduledJob> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toScheduledJob(rs));
                return out;
            }
        });
    }

    @Override
    public ScheduledJob applySpec(ObjectKey key, ScheduledJobSpec spec) throws StoreException {
        // Oracle MERGE (NAMESPACE, NAME 기준). status 컬럼은 건드리지 않는다
        return inTx("apply " + key, () -> {
            var template = spec.jobTemplate();
            var now = JdbcUtil.ts(clock.now());
            try (PreparedStatement ps = prepare("""
                    MERGE INTO TB_SCHEDULED_JOB d
                    USING (SELECT ? NAMESPACE, ? NAME FROM dual) s
                       ON (d.NAMESPACE = s.NAMESPACE AND d.NAME = s.NAME)
                    WHEN MATCHED THEN UPDATE SET
                         SCHEDULE                  = ?,
                         STARTING_DEADLINE_SECONDS = ?,
                         CONCURRENCY_POLICY        = ?,
                         SUSPEND                   = ?,
                         TEMPLATE_LABELS           = ?,
                         TEMPLATE_ANNOTATIONS      = ?,
                         TEMPLATE_BODY             = ?,
                         SUCCESSFUL_HISTORY_LIMIT  = ?,
                         FAILED_HISTORY_LIMIT      = ?,
                         RESOURCE_VERSION          = RESOURCE_VERSION + 1,
                         UPDATED_AT                = ?
                    WHEN NOT MATCHED THEN INSERT
                         (NAMESPACE, NAME, OBJ_UID, SCHEDULE, STARTING_DEADLINE_SECONDS, CONCURRENCY_POLICY,
                          SUSPEND, TEMPLATE_LABELS, TEMPLATE_ANNOTATIONS, TEMPLATE_BODY,
                          SUCCESSFUL_HISTORY_LIMIT, FAILED_HISTORY_LIMIT, RESOURCE_VERSION, CREATED_AT, UPDATED_AT)
                    VALUES (s.NAMESPACE, s.NAME, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1, ?, ?)
                    """)) {
                int i = 1;
                ps.setString(i++, key.namespace());
                ps.setString(i++, key.name());
                // UPDATE
                ps.setString(i++, spec.schedule());
                JdbcUtil.setLong(ps, i++, spec.startingDeadlineSeconds());
                ps.setString(i++, spec.concurrencyPolicy().code());
                ps.setString(i++, JdbcUtil.yn(spec.suspend()));
                ps.setString(i++, JsonColumns.write(template.labels()));
                ps.setString(i++, JsonColumns.write(template.annotations()));
                ps.setString(i++, template.body());
                JdbcUtil.setInt(ps, i++, spec.successfulJobsHistoryLimit());
                JdbcUtil.setInt(ps, i++, spec.failedJobsHistoryLimit());
                ps.setTimestamp(i++, now);
                // INSERT
                ps.setString(i++, UUID.randomUUID().toString());
                ps.setString(i++, spec.schedule());
                JdbcUtil.setLong(ps, i++, spec.startingDeadlineSeconds());
                ps.setString(i++, spec.concurrencyPolicy().code());
                ps.setString(i++, JdbcUtil.yn(spec.suspend()));
                ps.setString(i++, JsonColumns.write(template.labels()));
                ps.setString(i++, JsonColumns.write(template.annotations()));
                ps.setString(i++, template.body());
                JdbcUtil.setInt(ps, i++, spec.successfulJobsHistoryLimit());
                JdbcUtil.setInt(ps, i++, spec.failedJobsHistoryLimit());
                ps.setTimestamp(i++, now);
                ps.setTimestamp(i++, now);
                ps.executeUpdate();
            }
            return findScheduledJob(key)
                    .orElseThrow(() -> new StoreException("apply failed to load scheduled job " + key));
        });
    }

    private Optional<ScheduledJob> findScheduledJob(ObjectKey key) throws SQLException {
        try (PreparedStatement ps = prepare("SELECT * FROM TB_SCHEDULED_JOB WHERE NAMESPACE = ? AND NAME = ?")) {
            ps.setString(1, key.namespace());
            ps.setString(2, key.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toScheduledJob(rs));
            }
        }
    }

    private PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement ps = TxContext.require().prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds);
        return ps;
    }

    /** SQL 예외를 스토어 결과 종류로 바꾼다 */
    private <T> T inTx(String what, Callable<T> body) throws StoreException {
        try {
            return tx.required(body);
        } catch (StoreException e) {
            throw e;
        } catch (SQLIntegrityConstraintViolationException e) {
            // 유니크 키 위반만 "이미 있음". NOT NULL/CHECK/FK 위반은 일반 실패
            if (e.getErrorCode() == ORA_UNIQUE_VIOLATION) {
                throw new AlreadyExistsException(what + ": already exists", e);
            }
            throw new StoreException(what + ": constraint violated: " + e.getMessage(), e);
        } catch (SQLTimeoutException e) {
            throw new StoreException(what + ": timed out after " + queryTimeoutSeconds + "s", e);
        } catch (Exception e) {
            throw new StoreException(what + ": " + e.getMessage(), e);
        }
    }
}
