package com.booking.user.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/** Platform user who books appointments. Owned by the identity service; read-only here. */
@Entity @Table(name = "users") @Immutable
@Getter @Builder @NoArgsConstructor @AllArgsConstructor
public class User {
    @Id @Column(name = "id", length = 64) private String id;
    @Column(name = "full_name", nullable = false, length = 256) private String fullName;
}
