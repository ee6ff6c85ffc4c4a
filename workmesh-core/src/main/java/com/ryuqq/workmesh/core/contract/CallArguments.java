package com.ryuqq.workmesh.core.contract;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Work 진입 메서드 호출 인자 (위치 인자 + 이름 인자).
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * CallArguments.of(List.of("train.csv"), Map.of("batch", 5));
 * CallArguments.kwargs(Map.of("batch", 5));
 * CallArguments.none();
 * </pre>
 *
 * @param args 위치 인자 (null 불가, 원소는 null 가능)
 * @param kwargs 이름 인자 (null 불가)
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public record CallArguments(
    List<Object> args,
    Map<String, Object> kwargs
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException args 또는 kwargs가 null인 경우
     */
    public CallArguments {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        if (kwargs == null) {
            throw new IllegalArgumentException("kwargs cannot be null");
        }
        args = Collections.unmodifiableList(new java.util.ArrayList<>(args));
        kwargs = Collections.unmodifiableMap(new LinkedHashMap<>(kwargs));
    }

    public static CallArguments of(List<Object> args, Map<String, Object> kwargs) {
        return new CallArguments(args, kwargs);
    }

    public static CallArguments positional(Object... args) {
        return new CallArguments(java.util.Arrays.asList(args), Map.of());
    }

    public static CallArguments kwargs(Map<String, Object> kwargs) {
        return new CallArguments(List.of(), kwargs);
    }

    public static CallArguments none() {
        return new CallArguments(List.of(), Map.of());
    }

    /**
     * 이름 인자 조회.
     *
     * @param name 인자 이름
     * @return 값 (없으면 null)
     */
    public Object kwarg(String name) {
        return kwargs.get(name);
    }

    /**
     * 위치 인자 조회.
     *
     * @param index 위치
     * @return 값
     * @throws IndexOutOfBoundsException index가 범위를 벗어난 경우
     */
    public Object arg(int index) {
        return args.get(index);
    }
}
