package com.cred.freestyle.lottery.infrastructure.pos.naxml;

import com.cred.freestyle.lottery.infrastructure.pos.PriceBookAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NaxmlPriceBookWriter.
 */
@DisplayName("NaxmlPriceBookWriter Unit Tests")
class NaxmlPriceBookWriterTest {

    private final NaxmlPriceBookWriter writer = new NaxmlPriceBookWriter("LOTTERY", "NONTAX", "3.4");

    private static final List<String> UPCS = List.of("056300050002", "056300050019", "056300050026");

    // ========================================
    // buildDocument() Tests
    // ========================================

    @Test
    @DisplayName("buildDocument - AddUpdate: Should emit one active item per UPC in order")
    void buildDocument_AddUpdate() {
        // When
        NaxmlPriceBookMaintenance document = writer.buildDocument(
                "store-1", "Lucky 7s", new BigDecimal("2"), UPCS, PriceBookAction.ADD_UPDATE, "3.4");

        // Then
        assertThat(document.getVersion()).isEqualTo("3.4");
        assertThat(document.getXmlns()).isEqualTo("http://www.naxml.org/POSBO/Vocabulary/2003-10-16");
        assertThat(document.getMaintenanceHeader().getStoreLocationId()).isEqualTo("store-1");
        assertThat(document.getMaintenanceHeader().getMaintenanceType()).isEqualTo("Incremental");

        assertThat(document.getItems()).hasSize(3);
        assertThat(document.getItems()).extracting(NaxmlPriceBookMaintenance.Item::getItemCode)
                .containsExactlyElementsOf(UPCS);

        NaxmlPriceBookMaintenance.Item first = document.getItems().get(0);
        assertThat(first.getAction()).isEqualTo("AddUpdate");
        assertThat(first.getDescription()).isEqualTo("Lucky 7s #000");
        assertThat(first.getShortDescription()).isEqualTo("Lucky 7s");
        assertThat(first.getDepartmentCode()).isEqualTo("LOTTERY");
        assertThat(first.getUnitPrice()).isEqualTo("2.00");
        assertThat(first.getTaxRateCode()).isEqualTo("NONTAX");
        assertThat(first.getIsActive()).isEqualTo("Y");
        assertThat(document.getItems().get(2).getDescription()).isEqualTo("Lucky 7s #002");
    }

    @Test
    @DisplayName("buildDocument - Delete: Should mark every item inactive")
    void buildDocument_Delete() {
        // When
        NaxmlPriceBookMaintenance document = writer.buildDocument(
                "store-1", "Lucky 7s", new BigDecimal("2.00"), UPCS, PriceBookAction.DELETE, "3.4");

        // Then
        assertThat(document.getItems()).allSatisfy(item -> {
            assertThat(item.getAction()).isEqualTo("Delete");
            assertThat(item.getIsActive()).isEqualTo("N");
        });
    }

    @Test
    @DisplayName("buildDocument - Long game name: Should truncate the short description to 20 characters")
    void buildDocument_LongName() {
        // When
        NaxmlPriceBookMaintenance document = writer.buildDocument(
                "store-1", "Extremely Lucky Diamond Jackpot", new BigDecimal("20.00"),
                List.of("056300050002"), PriceBookAction.ADD_UPDATE, null);

        // Then
        assertThat(document.getItems().get(0).getShortDescription())
                .isEqualTo("Extremely Lucky Diam")
                .hasSize(NaxmlPriceBookWriter.SHORT_DESCRIPTION_LENGTH);
        assertThat(document.getItems().get(0).getDescription()).isEqualTo("Extremely Lucky Diamond Jackpot #000");
    }

    @Test
    @DisplayName("resolveVersion - Known, unknown and missing versions")
    void resolveVersion_FallsBackToDefault() {
        assertThat(writer.resolveVersion("4.0")).isEqualTo("4.0");
        assertThat(writer.resolveVersion("3.2")).isEqualTo("3.2");
        assertThat(writer.resolveVersion("9.9")).isEqualTo("3.4");
        assertThat(writer.resolveVersion(null)).isEqualTo("3.4");

        NaxmlPriceBookWriter misconfigured = new NaxmlPriceBookWriter("LOTTERY", "NONTAX", "bogus");
        assertThat(misconfigured.resolveVersion(null)).isEqualTo("3.4");
    }

    @Test
    @DisplayName("buildDocument - Version 4.0: Should use the 2020 vocabulary namespace")
    void buildDocument_Version40() {
        // When
        NaxmlPriceBookMaintenance document = writer.buildDocument(
                "store-1", "Lucky 7s", new BigDecimal("2.00"), UPCS, PriceBookAction.ADD_UPDATE, "4.0");

        // Then
        assertThat(document.getXmlns()).isEqualTo("http://www.naxml.org/POSBO/Vocabulary/2020-01-01");
    }

    // ========================================
    // write() Tests
    // ========================================

    @Test
    @DisplayName("write - Should render the NAXML element names with an XML declaration")
    void write_RendersXml() throws Exception {
        // Given
        NaxmlPriceBookMaintenance document = writer.buildDocument(
                "store-1", "Lucky 7s", new BigDecimal("2.00"), UPCS, PriceBookAction.ADD_UPDATE, "3.4");

        // When
        String xml = writer.write(document);

        // Then
        assertThat(xml).startsWith("<?xml");
        assertThat(xml).contains("<NAXMLPriceBookMaintenance");
        assertThat(xml).contains("version=\"3.4\"");
        assertThat(xml).contains("<StoreLocationID>store-1</StoreLocationID>");
        assertThat(xml).contains("<MaintenanceType>Incremental</MaintenanceType>");
        assertThat(xml).contains("<Items>");
        assertThat(xml).contains("Action=\"AddUpdate\"");
        assertThat(xml).contains("<ItemCode>056300050019</ItemCode>");
        assertThat(xml).contains("<UnitPrice>2.00</UnitPrice>");
        assertThat(xml).contains("<IsActive>Y</IsActive>");
    }
}
