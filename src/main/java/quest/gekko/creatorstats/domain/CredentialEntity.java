package quest.gekko.creatorstats.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * Stored credential row. {@code payload} holds the encrypted token material; expiry stays in clear
 * so that sweeps can select on it.
 */
@Entity
@Table(name = "user_credential",
        uniqueConstraints = @UniqueConstraint(columnNames = { "user_id", "platform" }),
        indexes = @Index(name = "idx_user_credential_expires_at", columnList = "expires_at"))
@Getter @Setter
public class CredentialEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "user_id", nullable = false)
    String userId;

    @Column(nullable = false, length = 50)
    String platform;

    @Column(nullable = false, columnDefinition = "TEXT")
    String payload;

    @Column(name = "expires_at")
    Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    Instant updatedAt;
}
