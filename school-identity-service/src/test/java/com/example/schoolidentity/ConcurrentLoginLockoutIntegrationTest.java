package com.example.schoolidentity;

import com.example.schoolidentity.dto.LoginRequest;
import com.example.schoolidentity.entity.LockoutState;
import com.example.schoolidentity.entity.Role;
import com.example.schoolidentity.entity.StaffAccount;
import com.example.schoolidentity.exception.InvalidCredentialsException;
import com.example.schoolidentity.repository.StaffAccountRepository;
import com.example.schoolidentity.service.AuthService;
import com.example.schoolidentity.support.TestAccounts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parallel failed logins against one account must each count, since the row is
 * locked for the whole read-modify-write.
 */
@SpringBootTest
@ActiveProfiles("test")
class ConcurrentLoginLockoutIntegrationTest {

    private static final String EMAIL = "busy@lockout.test";

    @Autowired
    private AuthService authService;
    @Autowired
    private StaffAccountRepository staffAccountRepository;
    @Autowired
    private PasswordEncoder passwordEncoder;

    private String accountId;

    @BeforeEach
    void seed() {
        staffAccountRepository.deleteAll();
        StaffAccount account = TestAccounts.staff(null, Role.TEACHER, "school-1");
        account.setEmail(EMAIL);
        account.setPasswordHash(passwordEncoder.encode("right-password"));
        accountId = staffAccountRepository.save(account).getId();
    }

    private List<Throwable> failInParallel(int attempts) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Throwable>> results = new ArrayList<>();
            for (int i = 0; i < attempts; i++) {
                String password = "wrong-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        authService.staffLogin(new LoginRequest(EMAIL, password));
                        return null;
                    } catch (RuntimeException e) {
                        return e;
                    }
                }));
            }
            start.countDown();

            List<Throwable> outcomes = new ArrayList<>();
            for (Future<Throwable> result : results) {
                outcomes.add(result.get(60, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void everyParallelFailureIsCounted() throws Exception {
        List<Throwable> outcomes = failInParallel(3);

        outcomes.forEach(outcome -> assertInstanceOf(InvalidCredentialsException.class, outcome));
        LockoutState lockout = staffAccountRepository.findById(accountId).orElseThrow().getLockout();
        assertEquals(3, lockout.getFailedAttempts());
        assertNull(lockout.getLockedUntil());
    }

    @Test
    void parallelFailuresReachingTheThresholdLockTheAccount() throws Exception {
        List<Throwable> outcomes = failInParallel(5);

        outcomes.forEach(outcome -> assertInstanceOf(InvalidCredentialsException.class, outcome));
        LockoutState lockout = staffAccountRepository.findById(accountId).orElseThrow().getLockout();
        assertEquals(5, lockout.getFailedAttempts());
        assertNotNull(lockout.getLockedUntil());
    }
}
