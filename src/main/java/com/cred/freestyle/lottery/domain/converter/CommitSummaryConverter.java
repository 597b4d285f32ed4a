package com.cred.freestyle.lottery.domain.converter;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

@Converter
public class CommitSummaryConverter extends JsonAttributeConverter<CommitSummary> {

    public CommitSummaryConverter() {
        super(new TypeReference<CommitSummary>() {
        });
    }
}
