package com.example.schoolidentity.repository;

import com.example.schoolidentity.entity.Student;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for the learner store.
 * Emails are unique per school, so lookups by email return lists unless scoped.
 */
@Repository
public interface StudentRepository extends JpaRepository<Student, String> {

    List<Student> findAllByEmail(String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM Student s WHERE s.id = :id")
    Optional<Student> findByIdForUpdate(@Param("id") String id);

    @Query("SELECT s FROM Student s WHERE s.role IS NULL")
    List<Student> findAllUntagged();
}
