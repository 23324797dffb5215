/**
 * Service Provider Interfaces.
 *
 * <ul>
 *   <li>{@link com.ryuqq.recordgraph.core.spi.Store} - asynchronous record store</li>
 *   <li>{@link com.ryuqq.recordgraph.core.spi.FieldIntrospector} - field enumeration of persistable objects</li>
 * </ul>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
package com.ryuqq.recordgraph.core.spi;
