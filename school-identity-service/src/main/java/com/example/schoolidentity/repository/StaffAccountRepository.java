package com.example.schoolidentity.repository;

import com.example.schoolidentity.entity.StaffAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the staff/admin store.
 *
 * Note: @SQLRestriction on StaffAccount filters deleted_at IS NULL for all queries.
 */
@Repository
public interface StaffAccountRepository extends JpaRepository<StaffAccount, String> {

    boolean existsByEmail(String email);

    /**
     * Row-locked lookup for login. Serializes concurrent attempts on the same
     * account so the failed-attempt counter is a single read-modify-write.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StaffAccount s WHERE s.email = :email")
    Optional<StaffAccount> findByEmailForUpdate(@Param("email") String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StaffAccount s WHERE s.id = :id")
    Optional<StaffAccount> findByIdForUpdate(@Param("id") String id);
}
