package com.ryuqq.recordgraph.core.fixture;

import com.ryuqq.recordgraph.core.object.AbstractPersistable;
import com.ryuqq.recordgraph.core.object.FieldDescriptor;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;
import com.ryuqq.recordgraph.core.object.TypeRegistry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 코어 테스트용 그래프 노드.
 */
public class Node extends AbstractPersistable {

    public enum Status { ACTIVE, RETIRED }

    public static final TypeDescriptor<Node> DESCRIPTOR = TypeDescriptor.builder(Node.class, Node::new)
        .field(FieldDescriptor.primitive("name", String.class, Node::getName, Node::setName))
        .field(FieldDescriptor.primitive("weight", Double.class, Node::getWeight, Node::setWeight))
        .field(FieldDescriptor.primitive("count", Integer.class, Node::getCount, Node::setCount))
        .field(FieldDescriptor.primitive("status", Status.class, Node::getStatus, Node::setStatus))
        .field(FieldDescriptor.primitive("seenAt", Instant.class, Node::getSeenAt, Node::setSeenAt))
        .field(FieldDescriptor.primitiveList("labels", String.class, Node::getLabels, Node::setLabels))
        .field(FieldDescriptor.asset("blob", Node::getBlob, Node::setBlob))
        .field(FieldDescriptor.reference("next", Node.class, Node::getNext, Node::setNext))
        .field(FieldDescriptor.referenceList("children", Node.class, Node::getChildren, Node::setChildren))
        .build();

    private String name;
    private Double weight;
    private Integer count;
    private Status status;
    private Instant seenAt;
    private List<String> labels = new ArrayList<>();
    private byte[] blob;
    private Node next;
    private List<Node> children = new ArrayList<>();

    public Node() {
    }

    public Node(String name) {
        this.name = name;
    }

    public static TypeRegistry registry() {
        return new TypeRegistry().register(DESCRIPTOR);
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Double getWeight() { return weight; }
    public void setWeight(Double weight) { this.weight = weight; }
    public Integer getCount() { return count; }
    public void setCount(Integer count) { this.count = count; }
    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }
    public Instant getSeenAt() { return seenAt; }
    public void setSeenAt(Instant seenAt) { this.seenAt = seenAt; }
    public List<String> getLabels() { return labels; }
    public void setLabels(List<String> labels) { this.labels = labels; }
    public byte[] getBlob() { return blob; }
    public void setBlob(byte[] blob) { this.blob = blob; }
    public Node getNext() { return next; }
    public void setNext(Node next) { this.next = next; }
    public List<Node> getChildren() { return children; }
    public void setChildren(List<Node> children) { this.children = children; }
}
