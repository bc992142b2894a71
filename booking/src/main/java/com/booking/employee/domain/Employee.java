package com.booking.employee.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/** Staff member an appointment may target. Read-only here. */
@Entity @Table(name = "employees") @Immutable
@Getter @Builder @NoArgsConstructor @AllArgsConstructor
public class Employee {
    @Id @Column(name = "id", length = 64) private String id;
    @Column(name = "full_name", nullable = false, length = 256) private String fullName;
    @Column(name = "hired_at") private Instant hiredAt;
}
