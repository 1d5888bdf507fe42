package com.ryuqq.delegation.core.composite;

import com.ryuqq.delegation.core.exception.DeletionDisallowedException;
import com.ryuqq.delegation.core.exception.DuplicatePropertyException;
import com.ryuqq.delegation.core.exception.MissingPropertyException;
import com.ryuqq.delegation.core.exception.OperationNotAllowedException;
import com.ryuqq.delegation.core.exception.OverrideDisallowedException;
import com.ryuqq.delegation.core.exception.ProtectedOperationException;
import com.ryuqq.delegation.core.exception.UnknownOwnPropertyException;
import com.ryuqq.delegation.core.exception.UnknownSourceException;
import com.ryuqq.delegation.core.model.OperationName;
import com.ryuqq.delegation.core.policy.CompositeConfig;
import com.ryuqq.delegation.core.policy.PolicyFlags;
import com.ryuqq.delegation.core.registry.OperationCallback;
import com.ryuqq.delegation.core.registry.OperationRegistry;
import com.ryuqq.delegation.core.spi.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Composite 위임 단위.
 *
 * <p>자체 저장소(own storage)와 순서가 있는 Source 목록을 하나의 핸들로 묶어,
 * 속성 존재 확인/읽기/쓰기/열거/삭제를 위임합니다. 다중 상속을 흉내 내는 합성입니다.</p>
 *
 * <p><strong>필수 Operation 5개:</strong></p>
 * <ul>
 *   <li>{@link #has(String)}: 자체 저장소 → Source 순서대로 확인 (첫 일치에서 종료)</li>
 *   <li>{@link #get(String)}: 자체 저장소 → Source 전체 스캔, 마지막 일치 값 반환</li>
 *   <li>{@link #set(String, Object)}: 자체 저장소에만 기록 (Source에는 절대 쓰지 않음)</li>
 *   <li>{@link #keys()}: 자체 키 + 각 Source 키 (중복 제거 없음)</li>
 *   <li>{@link #delete(String)}: 자체 저장소 우선, 그 외에는 allowDeletion에 따라 모든 Source에서 삭제</li>
 * </ul>
 *
 * <p><strong>해석 흐름 (get):</strong></p>
 * <pre>
 * own storage has key?  → return own value
 * for source in sources (left → right):
 *     source.has(key)?  → found = source.get(key); counter++
 * counter &gt; 1 &amp;&amp; !duplicationAllowed → DuplicatePropertyException
 * counter == 0 &amp;&amp; errorIfMissing     → MissingPropertyException
 * return found                         (마지막 일치, 없으면 null)
 * </pre>
 *
 * <p><strong>쓰기 경로 주의:</strong> Source에 존재하는 키에 대한 {@code set}은 해당 Source가 아니라
 * 자체 저장소에 기록되며, 이후 그 키는 자체 저장소 값이 Source 값을 가립니다.</p>
 *
 * <p><strong>재귀 합성:</strong> Composite는 {@link Source}를 구현하므로 다른 Composite의 Source가 될 수 있습니다.
 * 깊이 제한과 순환 감지는 없습니다. Source 그래프에 순환이 있으면 {@link StackOverflowError}가 발생합니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 없음. 여러 Composite가 공유하는 Source를 다중 스레드에서 변경하려면
 * 호출자가 직렬화해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Composite child = new Composite(List.of(engine, wheels));
 * child.get("horsePower");          // wheels에도 있으면 wheels 값 (마지막 일치)
 * child.set("color", "red");        // 자체 저장소에 기록
 * child.setAllowDeletion(true);
 * child.delete("serial");           // serial을 가진 모든 Source에서 삭제
 * </pre>
 *
 * @author Delegation Team
 * @since 1.0.0
 */
public class Composite implements Source {

    private static final Logger log = LoggerFactory.getLogger(Composite.class);

    private final Map<String, Object> ownStorage = new LinkedHashMap<>();
    private final SourceList sourceList;
    private final PolicyFlags flags;
    private final OperationRegistry registry = new OperationRegistry();

    /**
     * Source 없이 기본 설정으로 생성.
     */
    public Composite() {
        this(List.of(), CompositeConfig.defaults());
    }

    /**
     * 기본 설정으로 생성.
     *
     * @param sources 초기 Source 목록 (null이면 빈 목록, 같은 참조는 한 번만 추가)
     * @throws IllegalArgumentException sources에 null 원소가 있는 경우
     */
    public Composite(List<? extends Source> sources) {
        this(sources, CompositeConfig.defaults());
    }

    /**
     * 생성자.
     *
     * @param sources 초기 Source 목록 (null이면 빈 목록, 같은 참조는 한 번만 추가)
     * @param config 정책 플래그 초기값
     * @throws IllegalArgumentException config가 null이거나 sources에 null 원소가 있는 경우
     */
    public Composite(List<? extends Source> sources, CompositeConfig config) {
        this.flags = new PolicyFlags(config);
        this.sourceList = new SourceList(sources);
    }

    // ========== 필수 Operation ==========

    /**
     * 속성 존재 확인.
     *
     * <p>자체 저장소를 먼저 확인하고, 없으면 Source를 순서대로 확인하여 첫 일치에서 종료합니다.</p>
     *
     * @param key 속성 이름
     * @return 자체 저장소 또는 어느 Source에든 있으면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    @Override
    public boolean has(String key) {
        requireKey(key);
        if (ownStorage.containsKey(key)) {
            return true;
        }
        for (Source source : sourceList.live()) {
            if (source.has(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 속성 읽기.
     *
     * <p>자체 저장소에 없으면 Source 목록 전체를 스캔하며, 키를 가진 마지막 Source의 값을 반환합니다.</p>
     *
     * @param key 속성 이름
     * @return 속성 값 (어디에도 없고 errorIfMissing=false이면 null)
     * @throws IllegalArgumentException key가 null인 경우
     * @throws DuplicatePropertyException 2개 이상의 Source가 키를 가지고 duplicationAllowed=false인 경우
     * @throws MissingPropertyException 어디에도 없고 errorIfMissing=true인 경우
     */
    @Override
    public Object get(String key) {
        requireKey(key);
        if (ownStorage.containsKey(key)) {
            return ownStorage.get(key);
        }

        Object found = null;
        int counter = 0;
        for (Source source : sourceList.live()) {
            if (source.has(key)) {
                found = source.get(key);
                counter++;
            }
        }

        if (counter > 1 && !flags.isDuplicationAllowed()) {
            throw new DuplicatePropertyException(key, counter);
        }
        if (counter == 0 && flags.isErrorIfMissing()) {
            throw new MissingPropertyException(key);
        }
        return found;
    }

    /**
     * 속성 쓰기.
     *
     * <p>값은 항상 자체 저장소에 기록됩니다. Source에 있는 키라도 Source는 변경되지 않고,
     * 자체 저장소에 같은 이름의 속성이 생겨 이후 읽기에서 Source 값을 가립니다.</p>
     *
     * <p><strong>판정 순서 (자체 저장소에 키가 없을 때):</strong></p>
     * <ol>
     *   <li>키를 가진 Source가 하나라도 있으면 → 자체 저장소에 기록, 성공</li>
     *   <li>errorIfMissing=true → {@link MissingPropertyException}</li>
     *   <li>allowOverride=false → {@link OverrideDisallowedException}</li>
     *   <li>그 외 → 자체 저장소에 새 속성으로 기록</li>
     * </ol>
     *
     * @param key 속성 이름
     * @param value 값 (null 허용)
     * @throws IllegalArgumentException key가 null인 경우
     * @throws MissingPropertyException 어디에도 없고 errorIfMissing=true인 경우
     * @throws OverrideDisallowedException 어디에도 없고 allowOverride=false인 경우
     */
    public void set(String key, Object value) {
        requireKey(key);
        if (ownStorage.containsKey(key)) {
            ownStorage.put(key, value);
            return;
        }

        boolean found = false;
        for (Source source : sourceList.live()) {
            if (source.has(key)) {
                ownStorage.put(key, value);
                found = true;
            }
        }
        if (found) {
            return;
        }

        if (flags.isErrorIfMissing()) {
            throw new MissingPropertyException(key);
        }
        if (!flags.isAllowOverride()) {
            throw new OverrideDisallowedException(key);
        }
        ownStorage.put(key, value);
    }

    /**
     * 전체 속성 이름 열거.
     *
     * <p>자체 저장소 키 뒤에 각 Source의 {@link Source#keys()}를 목록 순서대로 이어 붙입니다.
     * 중복을 제거하지 않으므로 자체 저장소와 Source 2개에 있는 키는 3번 나타납니다.
     * 정책 플래그 등 내부 상태는 포함되지 않습니다.</p>
     *
     * @return 새 목록 (수정해도 Composite에 영향 없음)
     */
    @Override
    public List<String> keys() {
        List<String> names = new ArrayList<>(ownStorage.keySet());
        for (Source source : sourceList.live()) {
            names.addAll(source.keys());
        }
        return names;
    }

    /**
     * 속성 삭제.
     *
     * <p>자체 저장소에 있으면 플래그와 무관하게 삭제합니다. 그 외에는 allowDeletion=true일 때만
     * 키를 가진 <strong>모든</strong> Source에서 삭제합니다.</p>
     *
     * @param key 속성 이름
     * @return 하나 이상 삭제되었으면 true, 아무 Source에도 없었으면 false
     * @throws IllegalArgumentException key가 null인 경우
     * @throws DeletionDisallowedException 자체 저장소에 없고 allowDeletion=false인 경우
     */
    @Override
    public boolean delete(String key) {
        requireKey(key);
        if (ownStorage.containsKey(key)) {
            ownStorage.remove(key);
            return true;
        }
        if (!flags.isAllowDeletion()) {
            throw new DeletionDisallowedException(key);
        }

        boolean deleted = false;
        for (Source source : new ArrayList<>(sourceList.live())) {
            if (source.has(key) && source.delete(key)) {
                deleted = true;
            }
        }
        log.debug("Deleted '{}' from hierarchy sources: {}", key, deleted);
        return deleted;
    }

    // ========== Source 목록 관리 ==========

    /**
     * Source를 목록 끝에 추가.
     *
     * @param source 추가할 Source
     * @return 추가되었으면 true, 이미 있으면 false
     * @throws IllegalArgumentException source가 null인 경우
     */
    public boolean addSource(Source source) {
        return addSource(source, false);
    }

    /**
     * Source 추가.
     *
     * <p>앞에 추가하면 duplicationAllowed=true일 때 중복 속성은 뒤쪽 Source 값이 사용되므로
     * 이 Source의 값이 가려집니다.</p>
     *
     * @param source 추가할 Source
     * @param putUpfront true이면 목록 맨 앞, false이면 맨 뒤
     * @return 추가되었으면 true, 같은 참조가 이미 있으면 false
     * @throws IllegalArgumentException source가 null인 경우
     */
    public boolean addSource(Source source, boolean putUpfront) {
        requireSource(source);
        boolean added = sourceList.add(source, putUpfront);
        if (added) {
            log.debug("Source added ({}): {}", putUpfront ? "front" : "back", source);
        }
        return added;
    }

    /**
     * Source 제거 (silent).
     *
     * @param source 제거할 Source
     * @return 제거되었으면 true
     */
    public boolean removeSource(Source source) {
        return removeSource(source, true);
    }

    /**
     * Source 제거.
     *
     * @param source 제거할 Source (참조 동일성으로 비교)
     * @param silent false이면 목록에 없을 때 예외 발생
     * @return 제거되었으면 true
     * @throws UnknownSourceException 목록에 없고 silent=false인 경우
     */
    public boolean removeSource(Source source, boolean silent) {
        boolean removed = sourceList.remove(source, silent);
        if (removed) {
            log.debug("Source removed: {}", source);
        }
        return removed;
    }

    /**
     * 직속 Source 목록에 있는지 확인 (재귀하지 않음).
     *
     * @param source 확인할 Source
     * @return 같은 참조가 목록에 있으면 true
     */
    public boolean isSourceInHierarchy(Source source) {
        return sourceList.contains(source);
    }

    /**
     * 충돌 없이 추가 가능한지 확인.
     *
     * @param source 후보 Source
     * @return 아직 목록에 없고, 후보의 어떤 키도 {@link #keys()}에 없으면 true
     * @throws IllegalArgumentException source가 null인 경우
     */
    public boolean canSourceBeSafelyAdded(Source source) {
        requireSource(source);
        if (sourceList.contains(source)) {
            return false;
        }
        Set<String> existing = new HashSet<>(keys());
        for (String name : source.keys()) {
            if (existing.contains(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 충돌이 없을 때만 목록 끝에 추가.
     *
     * @param source 후보 Source
     * @return 추가되었으면 true
     * @throws IllegalArgumentException source가 null인 경우
     */
    public boolean addSourceIfSafe(Source source) {
        if (canSourceBeSafelyAdded(source)) {
            return addSource(source);
        }
        return false;
    }

    /**
     * 직속 Source 목록 (복사본이 아닌 실제 목록).
     *
     * <p><strong>주의:</strong> 반환된 목록을 직접 수정하면 참조 중복 금지 등
     * {@link #addSource(Source, boolean)}의 보장을 우회하게 됩니다.</p>
     *
     * @return 순서가 있는 Source 목록
     */
    public List<Source> sources() {
        return sourceList.live();
    }

    // ========== 자체 속성 관리 ==========

    /**
     * 자체 저장소에 속성 추가.
     *
     * <p>Hierarchy 어디에든 같은 키가 있고 allowOverride=false이면 거부합니다.
     * 허용되면 Source가 아닌 자체 저장소에만 기록합니다.</p>
     *
     * @param key 속성 이름
     * @param value 값 (null 허용)
     * @throws IllegalArgumentException key가 null인 경우
     * @throws OverrideDisallowedException 키가 이미 있고 allowOverride=false인 경우
     */
    public void addOwnProperty(String key, Object value) {
        requireKey(key);
        if (has(key) && !flags.isAllowOverride()) {
            throw new OverrideDisallowedException(key);
        }
        ownStorage.put(key, value);
        log.debug("Own property added: {}", key);
    }

    /**
     * 자체 저장소에서 속성 삭제 (silent).
     *
     * @param key 속성 이름
     * @return 삭제되었으면 true
     */
    public boolean deleteOwnProperty(String key) {
        return deleteOwnProperty(key, true);
    }

    /**
     * 자체 저장소에서 속성 삭제. Source는 건드리지 않습니다.
     *
     * @param key 속성 이름
     * @param silent false이면 없을 때 예외 발생
     * @return 삭제되었으면 true
     * @throws IllegalArgumentException key가 null인 경우
     * @throws UnknownOwnPropertyException 없고 silent=false인 경우
     */
    public boolean deleteOwnProperty(String key, boolean silent) {
        requireKey(key);
        if (!ownStorage.containsKey(key)) {
            if (!silent) {
                throw new UnknownOwnPropertyException(key);
            }
            return false;
        }
        ownStorage.remove(key);
        log.debug("Own property deleted: {}", key);
        return true;
    }

    /**
     * 자체 저장소에 키가 있는지 확인.
     *
     * @param key 속성 이름
     * @return 자체 저장소에 있으면 true
     */
    public boolean hasOwnProperty(String key) {
        return key != null && ownStorage.containsKey(key);
    }

    /**
     * 자체 저장소 키 목록.
     *
     * @return 새 목록 (삽입 순서)
     */
    public List<String> ownPropertyNames() {
        return new ArrayList<>(ownStorage.keySet());
    }

    // ========== 정책 플래그 ==========

    public boolean isDuplicationAllowed() {
        return flags.isDuplicationAllowed();
    }

    public void setDuplicationAllowed(boolean duplicationAllowed) {
        flags.setDuplicationAllowed(duplicationAllowed);
        log.debug("duplicationAllowed set to {}", duplicationAllowed);
    }

    public boolean isErrorIfMissing() {
        return flags.isErrorIfMissing();
    }

    public void setErrorIfMissing(boolean errorIfMissing) {
        flags.setErrorIfMissing(errorIfMissing);
        log.debug("errorIfMissing set to {}", errorIfMissing);
    }

    public boolean isAllowOverride() {
        return flags.isAllowOverride();
    }

    public void setAllowOverride(boolean allowOverride) {
        flags.setAllowOverride(allowOverride);
        log.debug("allowOverride set to {}", allowOverride);
    }

    public boolean isAllowDeletion() {
        return flags.isAllowDeletion();
    }

    public void setAllowDeletion(boolean allowDeletion) {
        flags.setAllowDeletion(allowDeletion);
        log.debug("allowDeletion set to {}", allowDeletion);
    }

    /**
     * 현재 정책 플래그 스냅샷.
     *
     * @return 현재 값으로 구성된 CompositeConfig
     */
    public CompositeConfig policySnapshot() {
        return flags.snapshot();
    }

    // ========== 확장 Operation ==========

    /**
     * 확장 Operation 등록 (silent=false).
     *
     * @param name Operation 이름
     * @param callback 콜백
     * @return 등록되었으면 true
     * @throws OperationNotAllowedException ELIGIBLE 이름이 아닌 경우
     */
    public boolean addOperation(OperationName name, OperationCallback callback) {
        return registry.add(name, callback, false);
    }

    /**
     * 확장 Operation 등록.
     *
     * @param name Operation 이름
     * @param callback 콜백
     * @param silent true이면 ELIGIBLE이 아닐 때 예외 대신 false 반환
     * @return 등록되었으면 true
     * @throws OperationNotAllowedException ELIGIBLE 이름이 아니고 silent=false인 경우
     */
    public boolean addOperation(OperationName name, OperationCallback callback, boolean silent) {
        return registry.add(name, callback, silent);
    }

    /**
     * 문자열 이름으로 확장 Operation 등록.
     *
     * @param name Operation 이름 (예: "apply")
     * @param callback 콜백
     * @param silent true이면 ELIGIBLE이 아닐 때 예외 대신 false 반환
     * @return 등록되었으면 true
     * @throws OperationNotAllowedException ELIGIBLE 이름이 아니고 silent=false인 경우
     */
    public boolean addOperation(String name, OperationCallback callback, boolean silent) {
        return registry.add(name, callback, silent);
    }

    /**
     * 확장 Operation 제거 (silent=true).
     *
     * @param name Operation 이름
     * @return ELIGIBLE 이름이면 true
     */
    public boolean removeOperation(OperationName name) {
        return registry.remove(name, true);
    }

    /**
     * 확장 Operation 제거.
     *
     * @param name Operation 이름
     * @param silent false이면 PROTECTED 이름일 때 예외 발생
     * @return ELIGIBLE 이름이면 true
     * @throws ProtectedOperationException PROTECTED 이름이고 silent=false인 경우
     */
    public boolean removeOperation(OperationName name, boolean silent) {
        return registry.remove(name, silent);
    }

    /**
     * 문자열 이름으로 확장 Operation 제거.
     *
     * @param name Operation 이름 (예: "ownKeys")
     * @param silent false이면 PROTECTED 이름일 때 예외 발생
     * @return ELIGIBLE 이름이면 true
     * @throws ProtectedOperationException PROTECTED 이름이고 silent=false인 경우
     */
    public boolean removeOperation(String name, boolean silent) {
        return registry.remove(name, silent);
    }

    /**
     * 등록된 확장 Operation 이름 (필수 Operation 5개는 포함되지 않음).
     *
     * @return 새 Set
     */
    public Set<OperationName> installedOperations() {
        return registry.installed();
    }

    /**
     * 등록된 확장 Operation 실행.
     *
     * @param name Operation 이름
     * @param arguments 콜백에 전달할 인자
     * @return 콜백 반환값
     * @throws IllegalArgumentException name이 null인 경우
     * @throws IllegalStateException 등록되지 않은 이름인 경우
     */
    public Object invokeOperation(OperationName name, Object... arguments) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        OperationCallback callback = registry.find(name)
            .orElseThrow(() -> new IllegalStateException("Operation not installed: " + name));
        List<Object> args = arguments == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(arguments)));
        return callback.invoke(this, args);
    }

    /**
     * ELIGIBLE 이름 집합.
     *
     * @return 새 Set
     */
    public static Set<OperationName> eligibleOperationNames() {
        return OperationRegistry.eligibleOperationNames();
    }

    /**
     * PROTECTED 이름 집합.
     *
     * @return 새 Set
     */
    public static Set<OperationName> protectedOperationNames() {
        return OperationRegistry.protectedOperationNames();
    }

    // ========== Introspection ==========

    /**
     * @see HierarchyInspector#occurrenceCount(Composite, String)
     */
    public int occurrenceCount(String key) {
        return HierarchyInspector.occurrenceCount(this, key);
    }

    /**
     * @see HierarchyInspector#duplicateNames(Composite)
     */
    public List<String> duplicateNames() {
        return HierarchyInspector.duplicateNames(this);
    }

    /**
     * @see HierarchyInspector#uniqueNames(Composite)
     */
    public List<String> uniqueNames() {
        return HierarchyInspector.uniqueNames(this);
    }

    @Override
    public String toString() {
        return "Composite{ownKeys=" + ownStorage.keySet() + ", sources=" + sourceList.size() + ", " + flags + '}';
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    private static void requireSource(Source source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
    }
}
