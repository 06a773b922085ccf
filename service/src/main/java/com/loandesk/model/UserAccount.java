package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read model of the user directory. Owned by the identity service; this service never writes it.
 */
@Entity
@Table(name = "app_user")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class UserAccount {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    private String email;

    private String phone;

    private String fullname;

    /**
     * The user whose referral brought this user in; receives commissions on this user's contracts.
     */
    @Column(name = "referred_by")
    private UUID referredBy;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
