package com.loandesk.repository;

import com.loandesk.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the user directory and its role tables.
 */
@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UUID> {

    long countByReferredBy(UUID referredBy);

    @Query(value = "SELECT DISTINCT r.code FROM role r " +
            "JOIN user_role ur ON ur.role_id = r.id " +
            "WHERE ur.user_id = :userId", nativeQuery = true)
    List<String> findRoleCodesByUserId(@Param("userId") UUID userId);

    @Query(value = "SELECT DISTINCT p.code FROM permission p " +
            "JOIN role_permission rp ON rp.permission_id = p.id " +
            "JOIN user_role ur ON ur.role_id = rp.role_id " +
            "WHERE ur.user_id = :userId", nativeQuery = true)
    List<String> findPermissionCodesByUserId(@Param("userId") UUID userId);
}
