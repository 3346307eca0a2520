package com.assessval.repository;

import com.assessval.model.enums.AppealStatus;
import com.assessval.model.property.Appeal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for appeals.
 */
@Repository
public interface AppealRepository extends JpaRepository<Appeal, Long> {

    Optional<Appeal> findByAppealNumber(String appealNumber);

    boolean existsByAppealNumber(String appealNumber);

    List<Appeal> findByPropertyIdOrderByIdAsc(String propertyId);

    List<Appeal> findByStatus(AppealStatus status);
}
