package net.cronkeeper.adapter.jdbc.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.cronkeeper.core.model.JobCondition;
import net.cronkeeper.core.model.ObjectRef;

import java.util.List;
import java.util.Map;

/** 맵/리스트 컬럼(CLOB) 의 JSON 인코딩 */
public final class JsonColumns {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            // 실행기가 모르는 조건 타입을 써도 읽기는 된다 (type=null → 완료 판정에서 무시)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<List<ObjectRef>> REF_LIST = new TypeReference<>() {};
    private static final TypeReference<List<JobCondition>> CONDITION_LIST = new TypeReference<>() {};

    private JsonColumns() {}

    public static String write(Object value) {
        if (value == null) return null;
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("unable to encode column value", e);
        }
    }

    public static Map<String, String> stringMap(String json) {
        return read(json, STRING_MAP, Map.of());
    }

    public static List<ObjectRef> refs(String json) {
        return read(json, REF_LIST, List.of());
    }

    public static List<JobCondition> conditions(String json) {
        return read(json, CONDITION_LIST, List.of());
    }

    private static <T> T read(String json, TypeReference<T> type, T empty) {
        if (json == null || json.isBlank()) return empty;
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("corrupt JSON column: " + e.getOriginalMessage(), e);
        }
    }
}
