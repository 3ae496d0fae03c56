package net.certauth.crl.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Factory method used to create ObjectMapper instances. Every mapper reading or writing persisted
 * CRL records must be created here so the document format stays the same across restarts.
 */
public class ObjectMapperFactory {
  private ObjectMapperFactory() {}

  public static ObjectMapper getObjectMapper() {
    return JsonMapper.builder()
        .configure(MapperFeature.OVERRIDE_PUBLIC_ACCESS_MODIFIERS, false)
        .configure(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS, false)
        .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true)
        .build();
  }
}
