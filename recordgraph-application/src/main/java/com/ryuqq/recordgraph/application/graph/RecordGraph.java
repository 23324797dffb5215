package com.ryuqq.recordgraph.application.graph;

import com.ryuqq.recordgraph.application.load.LoadPage;
import com.ryuqq.recordgraph.core.model.Identity;
import com.ryuqq.recordgraph.core.object.Persistable;
import com.ryuqq.recordgraph.core.query.QueryCursor;
import com.ryuqq.recordgraph.core.query.QueryPredicate;
import com.ryuqq.recordgraph.core.query.SortKey;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 객체 그래프 영속화 진입점.
 *
 * <p>서로 참조하는 객체 그래프를 레코드 단위 저장으로 변환하고, 저장된 레코드에서 참조를
 * 따라가며 객체를 복원합니다. 모든 연산은 비동기이며 실패 시 future가 도메인 예외
 * ({@code PersistenceException} 계열)로 완료됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Person alice = new Person("alice");
 * Person bob = new Person("bob");
 * alice.setFriend(bob);
 * bob.setFriend(alice);
 *
 * recordGraph.save(alice).join();           // 순환 참조는 지연 후 패치
 *
 * Person loaded = recordGraph.load(Person.class, alice.getIdentity().orElseThrow()).join();
 * loaded.getFriend().getFriend() == loaded; // true
 * </pre>
 *
 * @author RecordGraph Team
 * @since 1.0.0
 */
public interface RecordGraph {

    /**
     * 객체와 도달 가능한 참조 그래프 저장.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>대상 Identity 결정 (기존 Identity 또는 IdentityStrategy)</li>
     *   <li>필드 분류: 값 필드는 복사, 참조 필드는 하위 저장 또는 지연</li>
     *   <li>레코드 저장 후 Identity와 시스템 속성을 객체에 반영, 캐시</li>
     *   <li>지연된 참조가 있으면 대상 저장 후 필드를 패치하여 다시 저장</li>
     * </ol>
     *
     * @param object 저장할 객체
     * @return 같은 객체 (Identity, 시스템 속성 반영됨)
     * @throws IllegalArgumentException object가 null이거나 등록되지 않은 타입인 경우
     */
    <T extends Persistable> CompletableFuture<T> save(T object);

    /**
     * 신규 저장. Identity가 이미 있으면 RecordAlreadyExistsException으로 실패.
     */
    <T extends Persistable> CompletableFuture<T> insert(T object);

    /**
     * 기존 레코드 갱신. Identity가 없으면 RecordDoesNotExistException으로 실패.
     */
    <T extends Persistable> CompletableFuture<T> update(T object);

    /**
     * 존재하면 갱신, 없으면 객체의 Identity로 생성.
     */
    <T extends Persistable> CompletableFuture<T> upsert(T object);

    /**
     * Identity로 객체 조회 (캐시 우선).
     *
     * @param type 도메인 타입
     * @param identity Identity
     * @return 객체 (없으면 RecordNotFoundException으로 실패)
     */
    <T extends Persistable> CompletableFuture<T> load(Class<T> type, Identity identity);

    /**
     * 캐시를 무시하고 Store에서 다시 조회.
     */
    <T extends Persistable> CompletableFuture<T> refresh(Class<T> type, Identity identity);

    /**
     * 조건에 맞는 객체 한 페이지 조회.
     *
     * <p>디코딩에 실패한 레코드는 페이지를 실패시키지 않고 {@link LoadPage#partialErrors()}에
     * 기록됩니다.</p>
     */
    <T extends Persistable> CompletableFuture<LoadPage<T>> loadAll(Class<T> type, QueryPredicate predicate,
                                                                    List<SortKey> sortKeys, int limit);

    /**
     * 이전 페이지의 cursor에서 이어 조회.
     */
    <T extends Persistable> CompletableFuture<LoadPage<T>> loadNext(Class<T> type, QueryCursor cursor, int limit);

    /**
     * cursor가 없어질 때까지 모든 페이지 조회.
     */
    <T extends Persistable> CompletableFuture<LoadPage<T>> loadAllExhaustive(Class<T> type, QueryPredicate predicate,
                                                                              List<SortKey> sortKeys, int limit);

    /**
     * 객체의 레코드 삭제.
     */
    CompletableFuture<Void> delete(Persistable object);

    /**
     * 객체의 레코드와 그 레코드가 직접 참조하는 레코드 삭제.
     */
    CompletableFuture<Void> deleteCascade(Persistable object);
}
