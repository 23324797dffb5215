package com.ryuqq.recordgraph.testkit.fixture;

import com.ryuqq.recordgraph.core.object.AbstractPersistable;
import com.ryuqq.recordgraph.core.object.FieldDescriptor;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixture type covering every field kind except asset lists.
 *
 * <p>{@code friend} and {@code team} make it easy to build cycles:
 * Person ⇄ Person through {@code friend}, Person ⇄ Team through {@code team}/{@code leader}.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class Person extends AbstractPersistable {

    public static final TypeDescriptor<Person> DESCRIPTOR = TypeDescriptor.builder(Person.class, Person::new)
        .field(FieldDescriptor.primitive("name", String.class, Person::getName, Person::setName))
        .field(FieldDescriptor.primitive("age", Integer.class, Person::getAge, Person::setAge))
        .field(FieldDescriptor.primitive("role", Role.class, Person::getRole, Person::setRole))
        .field(FieldDescriptor.primitiveList("tags", String.class, Person::getTags, Person::setTags))
        .field(FieldDescriptor.asset("avatar", Person::getAvatar, Person::setAvatar))
        .field(FieldDescriptor.reference("friend", Person.class, Person::getFriend, Person::setFriend))
        .field(FieldDescriptor.reference("team", Team.class, Person::getTeam, Person::setTeam))
        .build();

    private String name;
    private Integer age;
    private Role role;
    private List<String> tags = new ArrayList<>();
    private byte[] avatar;
    private Person friend;
    private Team team;

    public Person() {
    }

    public Person(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public byte[] getAvatar() {
        return avatar;
    }

    public void setAvatar(byte[] avatar) {
        this.avatar = avatar;
    }

    public Person getFriend() {
        return friend;
    }

    public void setFriend(Person friend) {
        this.friend = friend;
    }

    public Team getTeam() {
        return team;
    }

    public void setTeam(Team team) {
        this.team = team;
    }

    @Override
    public String toString() {
        return "Person{" + name + ", identity=" + getIdentity().map(i -> i.getValue()).orElse("unsaved") + '}';
    }
}
