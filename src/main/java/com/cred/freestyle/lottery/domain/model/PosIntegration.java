package com.cred.freestyle.lottery.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * POS connection settings of a store. A store has at most one integration.
 * Managed by the store administration screens; read-only here.
 *
 * @author Lottery Back Office Team
 */
@Entity
@Table(name = "pos_integrations")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PosIntegration {

    @Id
    @Column(name = "pos_integration_id", nullable = false, length = 36)
    private String posIntegrationId;

    @Column(name = "store_id", nullable = false, unique = true, length = 36)
    private String storeId;

    /**
     * POS system type, e.g. GILBARCO_PASSPORT, VERIFONE_RUBY2, SQUARE_REST.
     */
    @Column(name = "pos_type", nullable = false, length = 50)
    private String posType;

    @Enumerated(EnumType.STRING)
    @Column(name = "connection_mode", length = 20)
    private ConnectionMode connectionMode;

    /**
     * Root of the store's XML gateway share. Price book files go to its BOInbox folder.
     */
    @Column(name = "xml_gateway_path", length = 500)
    private String xmlGatewayPath;

    @Column(name = "naxml_version", length = 10)
    private String naxmlVersion;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * How the back office exchanges data with the POS.
     */
    public enum ConnectionMode {
        API,
        FILE_EXCHANGE,
        NETWORK,
        MANUAL
    }
}
