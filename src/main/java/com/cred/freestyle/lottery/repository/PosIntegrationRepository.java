package com.cred.freestyle.lottery.repository;

import com.cred.freestyle.lottery.domain.model.PosIntegration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for PosIntegration entity.
 *
 * @author Lottery Back Office Team
 */
@Repository
public interface PosIntegrationRepository extends JpaRepository<PosIntegration, String> {

    Optional<PosIntegration> findByStoreId(String storeId);
}
