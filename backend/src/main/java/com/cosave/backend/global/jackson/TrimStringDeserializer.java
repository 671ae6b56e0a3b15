package com.cosave.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

/**
 * 문자열 입력 앞뒤 공백을 제거하는 역직렬화기. null은 그대로 둔다.
 * (로그인 email, 기기 이름 등 사람이 입력하는 값에 사용)
 */
public class TrimStringDeserializer extends JsonDeserializer<String> {

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String v = p.getValueAsString();
        if (v == null) return null;
        String t = v.trim();
        return t.isEmpty() ? null : t;
    }
}
