package com.ryuqq.recordgraph.testkit.fixture;

import com.ryuqq.recordgraph.core.object.TypeRegistry;

/**
 * Factory for fixture registries and object graphs.
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public final class Fixtures {

    private Fixtures() {
    }

    /**
     * Registry with every fixture type registered.
     */
    public static TypeRegistry registry() {
        return new TypeRegistry()
            .register(Person.DESCRIPTOR)
            .register(Team.DESCRIPTOR)
            .register(Document.DESCRIPTOR)
            .register(Note.DESCRIPTOR);
    }

    /**
     * Two people referencing each other through {@code friend}.
     *
     * @return the first person; {@code getFriend()} is the second
     */
    public static Person friendsCycle(String first, String second) {
        Person a = new Person(first);
        Person b = new Person(second);
        a.setFriend(b);
        b.setFriend(a);
        return a;
    }

    /**
     * A team whose leader points back to it through {@code team}.
     */
    public static Team teamWithLeader(String teamName, String leaderName) {
        Team team = new Team(teamName);
        Person leader = new Person(leaderName);
        leader.setTeam(team);
        team.setLeader(leader);
        return team;
    }
}
