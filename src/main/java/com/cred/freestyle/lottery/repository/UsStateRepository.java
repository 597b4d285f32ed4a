package com.cred.freestyle.lottery.repository;

import com.cred.freestyle.lottery.domain.model.UsState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for UsState entity.
 *
 * @author Lottery Back Office Team
 */
@Repository
public interface UsStateRepository extends JpaRepository<UsState, String> {
}
