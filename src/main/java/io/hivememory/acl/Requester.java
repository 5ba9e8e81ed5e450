package io.hivememory.acl;

/**
 * The principal behind a storage call.
 *
 * @param agentId     acting agent
 * @param teamId      team the agent belongs to, if any
 * @param swarmId     swarm the agent belongs to, if any
 * @param systemAgent whether the agent runs with system privileges
 */
public record Requester(String agentId, String teamId, String swarmId, boolean systemAgent) {

    public static Requester agent(String agentId) {
        return new Requester(agentId, null, null, false);
    }

    public static Requester member(String agentId, String teamId, String swarmId) {
        return new Requester(agentId, teamId, swarmId, false);
    }

    public static Requester system(String agentId) {
        return new Requester(agentId, null, null, true);
    }
}
