package com.cred.freestyle.lottery.infrastructure.pos.naxml;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.ArrayList;
import java.util.List;

/**
 * NAXML price book maintenance document as read by NAXML-capable POS back offices.
 *
 * <pre>
 * &lt;NAXMLPriceBookMaintenance version="3.4" xmlns="..."&gt;
 *   &lt;MaintenanceHeader&gt;...&lt;/MaintenanceHeader&gt;
 *   &lt;Items&gt;
 *     &lt;Item Action="AddUpdate"&gt;...&lt;/Item&gt;
 *   &lt;/Items&gt;
 * &lt;/NAXMLPriceBookMaintenance&gt;
 * </pre>
 *
 * @author Lottery Back Office Team
 */
@JacksonXmlRootElement(localName = "NAXMLPriceBookMaintenance")
@JsonPropertyOrder({"version", "xmlns", "maintenanceHeader", "items"})
public class NaxmlPriceBookMaintenance {

    @JacksonXmlProperty(isAttribute = true, localName = "version")
    private String version;

    @JacksonXmlProperty(isAttribute = true, localName = "xmlns")
    private String xmlns;

    @JacksonXmlProperty(localName = "MaintenanceHeader")
    private MaintenanceHeader maintenanceHeader;

    @JacksonXmlElementWrapper(localName = "Items")
    @JacksonXmlProperty(localName = "Item")
    private List<Item> items = new ArrayList<>();

    public NaxmlPriceBookMaintenance() {
    }

    public NaxmlPriceBookMaintenance(String version, String xmlns, MaintenanceHeader maintenanceHeader, List<Item> items) {
        this.version = version;
        this.xmlns = xmlns;
        this.maintenanceHeader = maintenanceHeader;
        this.items = items;
    }

    public String getVersion() {
        return version;
    }

    public String getXmlns() {
        return xmlns;
    }

    public MaintenanceHeader getMaintenanceHeader() {
        return maintenanceHeader;
    }

    public List<Item> getItems() {
        return items;
    }

    /**
     * Store and maintenance type of the document.
     */
    @JsonPropertyOrder({"storeLocationId", "maintenanceDate", "maintenanceType"})
    public static class MaintenanceHeader {

        @JacksonXmlProperty(localName = "StoreLocationID")
        private String storeLocationId;

        @JacksonXmlProperty(localName = "MaintenanceDate")
        private String maintenanceDate;

        /**
         * Full or Incremental.
         */
        @JacksonXmlProperty(localName = "MaintenanceType")
        private String maintenanceType;

        public MaintenanceHeader() {
        }

        public MaintenanceHeader(String storeLocationId, String maintenanceDate, String maintenanceType) {
            this.storeLocationId = storeLocationId;
            this.maintenanceDate = maintenanceDate;
            this.maintenanceType = maintenanceType;
        }

        public String getStoreLocationId() {
            return storeLocationId;
        }

        public String getMaintenanceDate() {
            return maintenanceDate;
        }

        public String getMaintenanceType() {
            return maintenanceType;
        }
    }

    /**
     * One price book line.
     */
    @JsonPropertyOrder({"action", "itemCode", "description", "shortDescription", "departmentCode",
            "unitPrice", "taxRateCode", "isActive"})
    public static class Item {

        @JacksonXmlProperty(isAttribute = true, localName = "Action")
        private String action;

        @JacksonXmlProperty(localName = "ItemCode")
        private String itemCode;

        @JacksonXmlProperty(localName = "Description")
        private String description;

        @JacksonXmlProperty(localName = "ShortDescription")
        private String shortDescription;

        @JacksonXmlProperty(localName = "DepartmentCode")
        private String departmentCode;

        @JacksonXmlProperty(localName = "UnitPrice")
        private String unitPrice;

        @JacksonXmlProperty(localName = "TaxRateCode")
        private String taxRateCode;

        /**
         * Y or N.
         */
        @JacksonXmlProperty(localName = "IsActive")
        private String isActive;

        public Item() {
        }

        public Item(String action, String itemCode, String description, String shortDescription,
                    String departmentCode, String unitPrice, String taxRateCode, String isActive) {
            this.action = action;
            this.itemCode = itemCode;
            this.description = description;
            this.shortDescription = shortDescription;
            this.departmentCode = departmentCode;
            this.unitPrice = unitPrice;
            this.taxRateCode = taxRateCode;
            this.isActive = isActive;
        }

        public String getAction() {
            return action;
        }

        public String getItemCode() {
            return itemCode;
        }

        public String getDescription() {
            return description;
        }

        public String getShortDescription() {
            return shortDescription;
        }

        public String getDepartmentCode() {
            return departmentCode;
        }

        public String getUnitPrice() {
            return unitPrice;
        }

        public String getTaxRateCode() {
            return taxRateCode;
        }

        public String getIsActive() {
            return isActive;
        }
    }
}
