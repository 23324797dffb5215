package com.ryuqq.recordgraph.testkit.fixture;

import com.ryuqq.recordgraph.core.object.AbstractPersistable;
import com.ryuqq.recordgraph.core.object.FieldDescriptor;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixture type with timestamps, numeric precision and asset lists.
 *
 * <p>Registered under the record kind {@code "doc"} rather than its class name.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class Document extends AbstractPersistable {

    public static final String RECORD_KIND = "doc";

    public static final TypeDescriptor<Document> DESCRIPTOR = TypeDescriptor.builder(Document.class, Document::new)
        .recordKind(RECORD_KIND)
        .field(FieldDescriptor.primitive("title", String.class, Document::getTitle, Document::setTitle))
        .field(FieldDescriptor.primitive("publishedAt", Instant.class, Document::getPublishedAt, Document::setPublishedAt))
        .field(FieldDescriptor.primitive("pageCount", Long.class, Document::getPageCount, Document::setPageCount))
        .field(FieldDescriptor.primitive("draft", Boolean.class, Document::getDraft, Document::setDraft))
        .field(FieldDescriptor.assetList("attachments", Document::getAttachments, Document::setAttachments))
        .field(FieldDescriptor.reference("owner", Person.class, Document::getOwner, Document::setOwner))
        .build();

    private String title;
    private Instant publishedAt;
    private Long pageCount;
    private Boolean draft;
    private List<byte[]> attachments = new ArrayList<>();
    private Person owner;

    public Document() {
    }

    public Document(String title) {
        this.title = title;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }

    public Long getPageCount() {
        return pageCount;
    }

    public void setPageCount(Long pageCount) {
        this.pageCount = pageCount;
    }

    public Boolean getDraft() {
        return draft;
    }

    public void setDraft(Boolean draft) {
        this.draft = draft;
    }

    public List<byte[]> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<byte[]> attachments) {
        this.attachments = attachments;
    }

    public Person getOwner() {
        return owner;
    }

    public void setOwner(Person owner) {
        this.owner = owner;
    }
}
