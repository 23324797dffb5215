package com.ryuqq.recordgraph.testkit.fixture;

import com.ryuqq.recordgraph.core.codec.DecodeContext;
import com.ryuqq.recordgraph.core.object.AbstractPersistable;
import com.ryuqq.recordgraph.core.object.CustomRecordCodec;
import com.ryuqq.recordgraph.core.object.TypeDescriptor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixture type persisted through a {@link CustomRecordCodec}.
 *
 * <p>The codec stores the text upper-cased under {@code body} and lower-cases it back on decode,
 * so a test can tell the custom path from the descriptor-driven one.</p>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public class Note extends AbstractPersistable {

    public static final TypeDescriptor<Note> DESCRIPTOR = TypeDescriptor.builder(Note.class, Note::new)
        .customCodec(new NoteCodec())
        .build();

    private String text;
    private boolean pinned;

    public Note() {
    }

    public Note(String text, boolean pinned) {
        this.text = text;
        this.pinned = pinned;
    }

    public String getText() {
        return text;
    }

    public boolean isPinned() {
        return pinned;
    }

    static final class NoteCodec implements CustomRecordCodec<Note> {

        @Override
        public Map<String, Object> encode(Note object) {
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("body", object.text == null ? null : object.text.toUpperCase());
            values.put("pinned", object.pinned);
            return values;
        }

        @Override
        public Note decode(Map<String, Object> values, DecodeContext context) {
            Object body = values.get("body");
            Object pinned = values.get("pinned");
            return new Note(body == null ? null : body.toString().toLowerCase(), Boolean.TRUE.equals(pinned));
        }
    }
}
