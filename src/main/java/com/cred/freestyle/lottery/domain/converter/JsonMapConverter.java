package com.cred.freestyle.lottery.domain.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.Map;

/**
 * Stores free-form audit values as a JSON object.
 *
 * @author Lottery Back Office Team
 */
@Converter
public class JsonMapConverter extends JsonAttributeConverter<Map<String, Object>> {

    public JsonMapConverter() {
        super(new TypeReference<Map<String, Object>>() {
        });
    }
}
