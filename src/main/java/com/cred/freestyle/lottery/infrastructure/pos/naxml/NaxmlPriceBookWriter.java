package com.cred.freestyle.lottery.infrastructure.pos.naxml;

import com.cred.freestyle.lottery.infrastructure.pos.PriceBookAction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders lottery ticket UPCs as an incremental NAXML price book maintenance document.
 *
 * @author Lottery Back Office Team
 */
@Component
public class NaxmlPriceBookWriter {

    public static final String MAINTENANCE_TYPE_INCREMENTAL = "Incremental";

    static final int SHORT_DESCRIPTION_LENGTH = 20;

    private static final Map<String, String> NAMESPACES = Map.of(
            "3.2", "http://www.naxml.org/POSBO/Vocabulary/2003-10-16",
            "3.4", "http://www.naxml.org/POSBO/Vocabulary/2003-10-16",
            "4.0", "http://www.naxml.org/POSBO/Vocabulary/2020-01-01"
    );

    private final XmlMapper xmlMapper;
    private final String departmentCode;
    private final String taxRateCode;
    private final String defaultVersion;

    public NaxmlPriceBookWriter(
            @Value("${lottery.pos.department-code:LOTTERY}") String departmentCode,
            @Value("${lottery.pos.tax-rate-code:NONTAX}") String taxRateCode,
            @Value("${lottery.pos.default-naxml-version:3.4}") String defaultVersion
    ) {
        this.departmentCode = departmentCode;
        this.taxRateCode = taxRateCode;
        this.defaultVersion = defaultVersion;

        this.xmlMapper = new XmlMapper();
        this.xmlMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.xmlMapper.enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION);
    }

    /**
     * Build the document model for one pack.
     *
     * @param storeId Store location written to the maintenance header
     * @param gameName Game name used for item descriptions
     * @param ticketPrice Unit price of every ticket
     * @param upcs Ticket UPCs in serial order
     * @param action AddUpdate or Delete
     * @param version NAXML version, null or unknown falls back to the configured default
     * @return Document model
     */
    public NaxmlPriceBookMaintenance buildDocument(
            String storeId,
            String gameName,
            BigDecimal ticketPrice,
            List<String> upcs,
            PriceBookAction action,
            String version
    ) {
        String resolvedVersion = resolveVersion(version);
        String unitPrice = formatPrice(ticketPrice);
        String shortDescription = gameName.length() > SHORT_DESCRIPTION_LENGTH
                ? gameName.substring(0, SHORT_DESCRIPTION_LENGTH)
                : gameName;

        List<NaxmlPriceBookMaintenance.Item> items = new ArrayList<>(upcs.size());
        for (int i = 0; i < upcs.size(); i++) {
            items.add(new NaxmlPriceBookMaintenance.Item(
                    action.getNaxmlValue(),
                    upcs.get(i),
                    String.format("%s #%03d", gameName, i),
                    shortDescription,
                    departmentCode,
                    unitPrice,
                    taxRateCode,
                    action.getActiveFlag()
            ));
        }

        NaxmlPriceBookMaintenance.MaintenanceHeader header = new NaxmlPriceBookMaintenance.MaintenanceHeader(
                storeId,
                Instant.now().toString(),
                MAINTENANCE_TYPE_INCREMENTAL
        );

        return new NaxmlPriceBookMaintenance(resolvedVersion, NAMESPACES.get(resolvedVersion), header, items);
    }

    /**
     * Serialize a document to XML text with an XML declaration.
     *
     * @throws JsonProcessingException if the document cannot be written
     */
    public String write(NaxmlPriceBookMaintenance document) throws JsonProcessingException {
        return xmlMapper.writeValueAsString(document);
    }

    String resolveVersion(String version) {
        if (version != null && NAMESPACES.containsKey(version)) {
            return version;
        }
        return NAMESPACES.containsKey(defaultVersion) ? defaultVersion : "3.4";
    }

    private static String formatPrice(BigDecimal price) {
        return price.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
