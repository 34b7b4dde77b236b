package vn.com.fecredit.videoupload.model;

import jakarta.persistence.*;
import lombok.Data;

/**
 * Account allowed to upload. The username is the owner id of its upload sessions.
 */
@Entity
@Table(name = "tenants")
@Data
public class TenantAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false)
    private String password; // BCrypt hash
}
