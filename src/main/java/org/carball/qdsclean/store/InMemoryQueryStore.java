package org.carball.qdsclean.store;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.qdsclean.config.RetentionThresholds;
import org.carball.qdsclean.model.cleanup.DeletionCandidate;
import org.carball.qdsclean.model.cleanup.QueryCategory;
import org.carball.qdsclean.model.store.CatalogObject;
import org.carball.qdsclean.model.store.PlanAggregate;
import org.carball.qdsclean.model.store.PlanFootprint;
import org.carball.qdsclean.model.store.PlanRecord;
import org.carball.qdsclean.model.store.QueryFootprint;
import org.carball.qdsclean.model.store.QueryRecord;
import org.carball.qdsclean.model.store.QueryText;
import org.carball.qdsclean.model.store.RuntimeStatsEntry;
import org.carball.qdsclean.model.store.WaitStatsEntry;
import org.carball.qdsclean.selector.RetentionPredicates;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Query Store held in memory, evaluated with {@link RetentionPredicates}.
 * Backs offline previews of exported snapshots.
 */
@Slf4j
public class InMemoryQueryStore implements QueryStoreRepository, QueryStoreAdministration {

    public static final String ONLINE = "ONLINE";

    @Getter
    private final String databaseName;
    private final String databaseState;
    private final String serverName;
    private final Clock clock;

    private final Map<Long, QueryRecord> queries = new TreeMap<>();
    private final Map<Long, QueryText> queryTexts = new TreeMap<>();
    private final Map<Long, PlanRecord> plans = new TreeMap<>();
    private final List<RuntimeStatsEntry> runtimeStats = new ArrayList<>();
    private final List<WaitStatsEntry> waitStats = new ArrayList<>();
    private final Map<Long, CatalogObject> objects = new TreeMap<>();
    private final List<String> administrativeCalls = new ArrayList<>();

    public InMemoryQueryStore(String databaseName, Clock clock) {
        this(databaseName, ONLINE, "localhost", clock);
    }

    public InMemoryQueryStore(String databaseName, String databaseState, String serverName, Clock clock) {
        this.databaseName = databaseName;
        this.databaseState = databaseState;
        this.serverName = serverName;
        this.clock = clock;
    }

    public InMemoryQueryStore addQuery(QueryRecord query, String sqlText) {
        queries.put(query.queryId(), query);
        queryTexts.put(query.queryTextId(), new QueryText(query.queryTextId(), sqlText));
        return this;
    }

    public InMemoryQueryStore addPlan(PlanRecord plan) {
        if (!queries.containsKey(plan.queryId())) {
            throw new IllegalArgumentException("Plan " + plan.planId() + " references unknown query " + plan.queryId());
        }
        plans.put(plan.planId(), plan);
        return this;
    }

    public InMemoryQueryStore addRuntimeStats(RuntimeStatsEntry entry) {
        runtimeStats.add(entry);
        return this;
    }

    public InMemoryQueryStore addWaitStats(WaitStatsEntry entry) {
        waitStats.add(entry);
        return this;
    }

    public InMemoryQueryStore addObject(CatalogObject object) {
        objects.put(object.objectId(), object);
        return this;
    }

    public InMemoryQueryStore dropObject(long objectId) {
        objects.remove(objectId);
        return this;
    }

    @Override
    public Optional<String> findDatabaseState(String name) {
        return databaseName.equalsIgnoreCase(name) ? Optional.of(databaseState) : Optional.empty();
    }

    @Override
    public String getServerName() {
        return serverName;
    }

    @Override
    public long countQueries() {
        return queries.size();
    }

    @Override
    public List<DeletionCandidate> findCandidates(QueryCategory category, RetentionThresholds thresholds) {
        OffsetDateTime now = OffsetDateTime.now(clock.withZone(ZoneOffset.UTC));
        List<DeletionCandidate> results = new ArrayList<>();
        for (PlanAggregate aggregate : aggregates()) {
            if (RetentionPredicates.matches(category, aggregate, thresholds, now, objects::containsKey)) {
                results.add(new DeletionCandidate(category, aggregate.queryId(), aggregate.planId(), aggregate.forced()));
            }
        }
        return results;
    }

    @Override
    public List<QueryFootprint> findQueryFootprints(Collection<Long> queryIds) {
        List<QueryFootprint> results = new ArrayList<>();
        for (Long queryId : queryIds) {
            QueryRecord query = queries.get(queryId);
            if (query == null) {
                continue;
            }
            CatalogObject owner = query.isAdhoc() ? null : objects.get(query.objectId());
            QueryText text = queryTexts.get(query.queryTextId());
            String sqlText = text != null ? text.sqlText() : null;
            results.add(new QueryFootprint(
                    query.queryId(),
                    query.objectId(),
                    owner != null ? owner.schemaName() : null,
                    owner != null ? owner.objectName() : null,
                    query.lastExecutionTime(),
                    sqlText,
                    nvarcharBytes(sqlText)
            ));
        }
        return results;
    }

    @Override
    public List<PlanFootprint> findPlanFootprints(Collection<Long> planIds) {
        List<PlanFootprint> results = new ArrayList<>();
        for (Long planId : planIds) {
            PlanRecord plan = plans.get(planId);
            if (plan == null) {
                continue;
            }
            long runtimeRows = runtimeStats.stream().filter(rs -> rs.planId() == planId).count();
            long executions = runtimeStats.stream()
                    .filter(rs -> rs.planId() == planId)
                    .mapToLong(RuntimeStatsEntry::countExecutions)
                    .sum();
            long waitRows = waitStats.stream().filter(ws -> ws.planId() == planId).count();
            results.add(new PlanFootprint(planId, plan.queryId(), nvarcharBytes(plan.queryPlan()),
                    runtimeRows, waitRows, executions));
        }
        return results;
    }

    @Override
    public void unforcePlan(long queryId, long planId) throws SQLException {
        administrativeCalls.add("unforce_plan(" + queryId + "," + planId + ")");
        PlanRecord plan = plans.get(planId);
        if (plan == null || plan.queryId() != queryId) {
            throw new SQLException("Plan " + planId + " of query " + queryId + " does not exist");
        }
        if (plan.forced()) {
            plans.put(planId, plan.withForced(false));
        }
    }

    @Override
    public void removeQuery(long queryId) throws SQLException {
        administrativeCalls.add("remove_query(" + queryId + ")");
        QueryRecord query = queries.get(queryId);
        if (query == null) {
            throw new SQLException("Query " + queryId + " does not exist");
        }
        List<Long> planIds = new ArrayList<>();
        for (PlanRecord plan : plans.values()) {
            if (plan.queryId() == queryId) {
                if (plan.forced()) {
                    throw new SQLException("Query " + queryId + " has forced plan " + plan.planId()
                            + " and cannot be removed");
                }
                planIds.add(plan.planId());
            }
        }

        planIds.forEach(plans::remove);
        runtimeStats.removeIf(rs -> planIds.contains(rs.planId()));
        waitStats.removeIf(ws -> planIds.contains(ws.planId()));
        queries.remove(queryId);

        boolean textShared = queries.values().stream().anyMatch(q -> q.queryTextId() == query.queryTextId());
        if (!textShared) {
            queryTexts.remove(query.queryTextId());
        }
        log.debug("Removed query {} with {} plans", queryId, planIds.size());
    }

    public boolean containsQuery(long queryId) {
        return queries.containsKey(queryId);
    }

    public List<QueryRecord> getQueries() {
        return List.copyOf(queries.values());
    }

    public List<QueryText> getQueryTexts() {
        return List.copyOf(queryTexts.values());
    }

    public List<PlanRecord> getPlans() {
        return List.copyOf(plans.values());
    }

    public List<RuntimeStatsEntry> getRuntimeStats() {
        return List.copyOf(runtimeStats);
    }

    public List<WaitStatsEntry> getWaitStats() {
        return List.copyOf(waitStats);
    }

    public List<CatalogObject> getObjects() {
        return List.copyOf(objects.values());
    }

    /** Administrative calls in the order they were received, including failed ones. */
    public List<String> getAdministrativeCalls() {
        return Collections.unmodifiableList(administrativeCalls);
    }

    private List<PlanAggregate> aggregates() {
        List<PlanAggregate> aggregates = new ArrayList<>();
        for (PlanRecord plan : plans.values()) {
            QueryRecord query = queries.get(plan.queryId());
            List<RuntimeStatsEntry> planStats = runtimeStats.stream()
                    .filter(rs -> rs.planId() == plan.planId())
                    .toList();
            long executions = planStats.stream().mapToLong(RuntimeStatsEntry::countExecutions).sum();
            aggregates.add(new PlanAggregate(
                    query.queryId(),
                    plan.planId(),
                    query.objectId(),
                    plan.forced(),
                    query.internal(),
                    executions,
                    query.lastExecutionTime(),
                    !planStats.isEmpty()
            ));
        }
        aggregates.sort((a, b) -> a.queryId() != b.queryId()
                ? Long.compare(a.queryId(), b.queryId())
                : Long.compare(a.planId(), b.planId()));
        return aggregates;
    }

    /**
     * Data length of an NVARCHAR value: two bytes per UTF-16 code unit.
     */
    static long nvarcharBytes(String value) {
        return value == null ? 0 : 2L * value.length();
    }
}
