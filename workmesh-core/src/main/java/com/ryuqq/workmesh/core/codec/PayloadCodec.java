package com.ryuqq.workmesh.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ryuqq.workmesh.core.contract.CallArguments;
import com.ryuqq.workmesh.core.model.Payload;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 호출 인자와 반환값의 JSON 직렬화.
 *
 * <p>큐를 건너는 값은 모두 이 코덱을 거치므로, 호출자와 실행 컨텍스트는 같은 객체를
 * 공유하지 않습니다. 역직렬화 결과는 JSON 기본 타입(Map, List, String, Number, Boolean, null)입니다.</p>
 *
 * <p><strong>Wire format:</strong></p>
 * <pre>
 * arguments: {"args":[...],"kwargs":{...}}
 * value:     any JSON value
 * </pre>
 *
 * @author WorkMesh Team
 * @since 1.0.0
 */
public final class PayloadCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public PayloadCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 호출 인자 직렬화.
     *
     * @param arguments 호출 인자
     * @return {"args":[...],"kwargs":{...}} 형태의 Payload
     * @throws IllegalArgumentException arguments가 null이거나 JSON으로 표현할 수 없는 값을 포함한 경우
     */
    public Payload encodeArguments(CallArguments arguments) {
        if (arguments == null) {
            throw new IllegalArgumentException("arguments cannot be null");
        }
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("args", arguments.args());
        wire.put("kwargs", arguments.kwargs());
        return Payload.of(write(wire));
    }

    /**
     * 호출 인자 역직렬화.
     *
     * @param payload {@link #encodeArguments(CallArguments)}가 만든 Payload
     * @return 호출 인자
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public CallArguments decodeArguments(Payload payload) {
        Map<String, Object> wire = read(payload, MAP_TYPE);
        if (wire == null) {
            return CallArguments.none();
        }
        Object args = wire.getOrDefault("args", List.of());
        Object kwargs = wire.getOrDefault("kwargs", Map.of());
        if (!(args instanceof List<?> argList) || !(kwargs instanceof Map<?, ?> kwargMap)) {
            throw new IllegalArgumentException("Malformed call arguments payload: " + payload.getValue());
        }
        Map<String, Object> typedKwargs = new LinkedHashMap<>();
        kwargMap.forEach((key, value) -> typedKwargs.put(String.valueOf(key), value));
        return CallArguments.of(new ArrayList<>(argList), typedKwargs);
    }

    /**
     * 반환값 직렬화.
     *
     * @param value 반환값 (null 가능)
     * @return Payload (null이면 {@link Payload#empty()})
     */
    public Payload encodeValue(Object value) {
        if (value == null) {
            return Payload.empty();
        }
        return Payload.of(write(value));
    }

    /**
     * 반환값 역직렬화.
     *
     * @param payload 직렬화된 반환값
     * @return JSON 기본 타입으로 복원된 값 (null 가능)
     */
    public Object decodeValue(Payload payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        return read(payload, new TypeReference<Object>() { });
    }

    /**
     * 값을 JSON 기본 타입으로 정규화 (직렬화 후 역직렬화).
     *
     * <p>Delta 값과 상태 사본이 원격 측 객체를 참조하지 않도록 할 때 사용합니다.</p>
     *
     * @param value 원본 값
     * @return 정규화된 사본
     */
    public Object normalize(Object value) {
        return decodeValue(encodeValue(value));
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value of type " + value.getClass().getName(), e);
        }
    }

    private <T> T read(Payload payload, TypeReference<T> type) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        try {
            return mapper.readValue(payload.getValue(), type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize payload: " + payload, e);
        }
    }
}
