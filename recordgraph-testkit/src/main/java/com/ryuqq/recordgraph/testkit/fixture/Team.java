package com.ryuqq.recordgraph.testkit.fixture;

import com.ryuqq.recordgraph.core.object.AbstractPersistable;
import com.ryuqq.recordgraph.core.object.FieldDescriptor;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixture type with a reference list ({@code members}) and a single reference ({@code leader}).
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class Team extends AbstractPersistable {

    public static final TypeDescriptor<Team> DESCRIPTOR = TypeDescriptor.builder(Team.class, Team::new)
        .field(FieldDescriptor.primitive("name", String.class, Team::getName, Team::setName))
        .field(FieldDescriptor.reference("leader", Person.class, Team::getLeader, Team::setLeader))
        .field(FieldDescriptor.referenceList("members", Person.class, Team::getMembers, Team::setMembers))
        .build();

    private String name;
    private Person leader;
    private List<Person> members = new ArrayList<>();

    public Team() {
    }

    public Team(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Person getLeader() {
        return leader;
    }

    public void setLeader(Person leader) {
        this.leader = leader;
    }

    public List<Person> getMembers() {
        return members;
    }

    public void setMembers(List<Person> members) {
        this.members = members;
    }
}
