package com.loandesk.service;

import com.loandesk.repository.UserAccountRepository;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Role and permission lookups over the user directory.
 */
@Service
@AllArgsConstructor
public class RbacService {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_USER = "USER";
    public static final String ROLE_CTV = "CTV";

    public static final String PERMISSION_CREATE_FOR_OTHERS = "contract.create_for_others";

    private final UserAccountRepository userAccountRepository;

    public Set<String> getUserPermissions(UUID userId) {
        return new HashSet<>(userAccountRepository.findPermissionCodesByUserId(userId));
    }

    public Set<String> getUserRoles(UUID userId) {
        return new HashSet<>(userAccountRepository.findRoleCodesByUserId(userId));
    }

    public boolean hasPermission(UUID userId, String permission) {
        if (userId == null || permission == null) {
            return false;
        }
        return getUserPermissions(userId).contains(permission);
    }

    public boolean hasRole(UUID userId, String roleCode) {
        if (userId == null || roleCode == null) {
            return false;
        }
        return getUserRoles(userId).contains(roleCode);
    }
}
