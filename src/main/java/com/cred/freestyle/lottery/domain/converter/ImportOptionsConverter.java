package com.cred.freestyle.lottery.domain.converter;

import com.cred.freestyle.lottery.domain.importing.ImportOptions;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class ImportOptionsConverter extends JsonAttributeConverter<ImportOptions> {

    public ImportOptionsConverter() {
        super(new TypeReference<ImportOptions>() {
        });
    }
}
