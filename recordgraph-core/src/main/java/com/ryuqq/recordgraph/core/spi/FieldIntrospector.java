package com.ryuqq.recordgraph.core.spi;

import com.ryuqq.recordgraph.core.object.FieldEntry;
import com.ryuqq.recordgraph.core.object.Persistable;

import java.util.List;

/**
 * Field enumeration SPI.
 *
 * <p>Supplies the record kind and the ordered (name, value, declared kind) entries of a
 * persistable object. The default implementation reads registered type descriptors; an
 * alternative can plug in annotation processing or generated accessors.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Entry order must be stable for a given type</li>
 *   <li>Must not mutate the inspected object</li>
 *   <li>Thread-safe</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public interface FieldIntrospector {

    /**
     * Returns the record kind (type name) under which objects of this type are stored.
     *
     * @param object the object
     * @return the record kind
     * @throws IllegalArgumentException if the object's type is unknown
     */
    String recordKindOf(Persistable object);

    /**
     * Enumerates the domain fields of an object.
     *
     * @param object the object
     * @return field entries in declaration order (values may be null)
     * @throws IllegalArgumentException if the object's type is unknown
     */
    List<FieldEntry> fieldsOf(Persistable object);
}
