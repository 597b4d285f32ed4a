package com.cred.freestyle.lottery.domain.converter;

import com.cred.freestyle.lottery.domain.importing.ValidatedRow;
import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores the validated row snapshot of a pending import, keeping each row's status discriminator.
 *
 * @author Lottery Back Office Team
 */
@Converter
public class ValidatedRowListConverter extends JsonAttributeConverter<List<ValidatedRow>> {

    public ValidatedRowListConverter() {
        super(new TypeReference<List<ValidatedRow>>() {
        });
    }
}
