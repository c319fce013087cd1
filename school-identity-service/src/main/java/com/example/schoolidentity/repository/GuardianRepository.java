package com.example.schoolidentity.repository;

import com.example.schoolidentity.entity.Guardian;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the guardian store.
 */
@Repository
public interface GuardianRepository extends JpaRepository<Guardian, String> {

    List<Guardian> findAllByEmail(String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Guardian g WHERE g.id = :id")
    Optional<Guardian> findByIdForUpdate(@Param("id") String id);

    /**
     * Guardians currently linked to a learner. Queried at delivery time, never cached.
     */
    @Query("SELECT g FROM Guardian g WHERE :studentId MEMBER OF g.studentIds")
    List<Guardian> findAllLinkedTo(@Param("studentId") String studentId);

    @Query("SELECT g FROM Guardian g WHERE g.role IS NULL")
    List<Guardian> findAllUntagged();
}
