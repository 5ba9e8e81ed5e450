package io.hivememory.core;

import java.util.List;

/**
 * Logical tables of the engine. Core tables are created when the database opens;
 * the rest are created on first use so that a database file prepared by setup
 * tooling without the canonical schema still works.
 */
public enum SchemaTable {

    MEMORY_ENTRIES(true, List.of("""
            CREATE TABLE IF NOT EXISTS memory_entries (
                key TEXT NOT NULL,
                partition TEXT NOT NULL DEFAULT 'default',
                value TEXT NOT NULL,
                owner TEXT NOT NULL,
                access_level TEXT NOT NULL DEFAULT 'private',
                team_id TEXT,
                swarm_id TEXT,
                ttl_seconds INTEGER NOT NULL DEFAULT 0,
                expires_at INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                last_modified INTEGER NOT NULL,
                origin_node TEXT,
                PRIMARY KEY (key, partition)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_memory_partition ON memory_entries(partition)",
            "CREATE INDEX IF NOT EXISTS idx_memory_expires ON memory_entries(expires_at)",
            "CREATE INDEX IF NOT EXISTS idx_memory_owner ON memory_entries(owner)",
            "CREATE INDEX IF NOT EXISTS idx_memory_modified ON memory_entries(last_modified)")),

    MEMORY_ACL(true, List.of("""
            CREATE TABLE IF NOT EXISTS memory_acl (
                resource_id TEXT PRIMARY KEY,
                owner TEXT NOT NULL,
                access_level TEXT NOT NULL,
                team_id TEXT,
                swarm_id TEXT,
                granted_permissions TEXT,
                blocked_agents TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_acl_owner ON memory_acl(owner)")),

    HINTS(false, List.of("""
            CREATE TABLE IF NOT EXISTS hints (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                partition TEXT NOT NULL DEFAULT 'default',
                key TEXT NOT NULL,
                value TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                expires_at INTEGER NOT NULL DEFAULT 0
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_hints_key ON hints(partition, key)",
            "CREATE INDEX IF NOT EXISTS idx_hints_expires ON hints(expires_at)")),

    EVENTS(false, List.of("""
            CREATE TABLE IF NOT EXISTS events (
                id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                payload TEXT NOT NULL,
                source TEXT NOT NULL,
                timestamp INTEGER NOT NULL,
                expires_at INTEGER NOT NULL DEFAULT 0
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_events_type ON events(type, timestamp)",
            "CREATE INDEX IF NOT EXISTS idx_events_source ON events(source)",
            "CREATE INDEX IF NOT EXISTS idx_events_expires ON events(expires_at)")),

    WORKFLOW_STATE(false, List.of("""
            CREATE TABLE IF NOT EXISTS workflow_state (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                workflow_id TEXT NOT NULL,
                step TEXT NOT NULL,
                status TEXT NOT NULL,
                checkpoint TEXT NOT NULL,
                sha TEXT NOT NULL,
                ttl INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_workflow_id ON workflow_state(workflow_id, id)",
            "CREATE INDEX IF NOT EXISTS idx_workflow_status ON workflow_state(status)")),

    PATTERNS(false, List.of("""
            CREATE TABLE IF NOT EXISTS patterns (
                id TEXT PRIMARY KEY,
                content TEXT NOT NULL,
                embedding BLOB NOT NULL,
                confidence REAL NOT NULL,
                usage_count INTEGER NOT NULL DEFAULT 1,
                success_rate REAL,
                agent_id TEXT,
                domain TEXT,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_patterns_agent ON patterns(agent_id)",
            "CREATE INDEX IF NOT EXISTS idx_patterns_domain ON patterns(domain)")),

    LEARNING_EXPERIENCES(false, List.of("""
            CREATE TABLE IF NOT EXISTS learning_experiences (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                agent_id TEXT NOT NULL,
                state TEXT NOT NULL,
                action TEXT NOT NULL,
                reward REAL NOT NULL,
                next_state TEXT NOT NULL,
                timestamp INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_learning_exp_agent ON learning_experiences(agent_id)")),

    Q_VALUES(false, List.of("""
            CREATE TABLE IF NOT EXISTS q_values (
                agent_id TEXT NOT NULL,
                state_key TEXT NOT NULL,
                action_key TEXT NOT NULL,
                q_value REAL NOT NULL DEFAULT 0,
                update_count INTEGER NOT NULL DEFAULT 0,
                last_updated INTEGER NOT NULL,
                PRIMARY KEY (agent_id, state_key, action_key)
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_q_values_agent ON q_values(agent_id)")),

    LEARNING_HISTORY(false, List.of("""
            CREATE TABLE IF NOT EXISTS learning_history (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                agent_id TEXT NOT NULL,
                snapshot_type TEXT NOT NULL,
                metrics TEXT NOT NULL,
                total_experiences INTEGER NOT NULL,
                exploration_rate REAL NOT NULL,
                timestamp INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_learning_hist_agent ON learning_history(agent_id)")),

    CONSENSUS_STATE(false, List.of("""
            CREATE TABLE IF NOT EXISTS consensus_state (
                id TEXT PRIMARY KEY,
                decision TEXT NOT NULL,
                proposer TEXT NOT NULL,
                votes TEXT NOT NULL,
                quorum INTEGER NOT NULL,
                status TEXT NOT NULL,
                version INTEGER NOT NULL DEFAULT 1,
                ttl INTEGER NOT NULL DEFAULT 604800,
                expires_at INTEGER NOT NULL DEFAULT 0,
                created_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_consensus_status ON consensus_state(status)",
            "CREATE INDEX IF NOT EXISTS idx_consensus_expires ON consensus_state(expires_at)")),

    AGENT_REGISTRY(false, List.of("""
            CREATE TABLE IF NOT EXISTS agent_registry (
                id TEXT PRIMARY KEY,
                type TEXT NOT NULL,
                capabilities TEXT NOT NULL,
                status TEXT NOT NULL,
                performance TEXT NOT NULL,
                created_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_agent_status ON agent_registry(status)",
            "CREATE INDEX IF NOT EXISTS idx_agent_type ON agent_registry(type)")),

    GOAP_GOALS(false, List.of("""
            CREATE TABLE IF NOT EXISTS goap_goals (
                id TEXT PRIMARY KEY,
                conditions TEXT NOT NULL,
                cost INTEGER NOT NULL,
                priority TEXT,
                created_at INTEGER NOT NULL
            )
            """)),

    GOAP_ACTIONS(false, List.of("""
            CREATE TABLE IF NOT EXISTS goap_actions (
                id TEXT PRIMARY KEY,
                preconditions TEXT NOT NULL,
                effects TEXT NOT NULL,
                cost INTEGER NOT NULL,
                agent_type TEXT,
                created_at INTEGER NOT NULL
            )
            """)),

    GOAP_PLANS(false, List.of("""
            CREATE TABLE IF NOT EXISTS goap_plans (
                id TEXT PRIMARY KEY,
                goal_id TEXT NOT NULL,
                sequence TEXT NOT NULL,
                total_cost INTEGER NOT NULL,
                created_at INTEGER NOT NULL
            )
            """));

    private final boolean core;
    private final List<String> ddl;

    SchemaTable(boolean core, List<String> ddl) {
        this.core = core;
        this.ddl = ddl;
    }

    public boolean isCore() {
        return core;
    }

    public List<String> ddl() {
        return ddl;
    }

    public String tableName() {
        return name().toLowerCase();
    }
}
