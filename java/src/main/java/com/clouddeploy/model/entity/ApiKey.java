package com.clouddeploy.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * API key owned by a single user. Only the SHA-256 digest of the secret is
 * stored, with enough of both ends kept to show a masked form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKey {

    @Id
    private UUID id;

    @Column("user_id")
    private UUID userId;

    @Column("name")
    private String name;

    @Column("key_hash")
    private String keyHash;

    @Column("key_prefix")
    private String keyPrefix;

    @Column("key_suffix")
    private String keySuffix;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("last_used_at")
    private LocalDateTime lastUsedAt;

    public String maskedKey() {
        return keyPrefix + "..." + keySuffix;
    }
}
