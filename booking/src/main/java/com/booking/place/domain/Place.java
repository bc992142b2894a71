package com.booking.place.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/** A location appointments are booked at. Maintained outside this service; read-only here. */
@Entity @Table(name = "places") @Immutable
@Getter @Builder @NoArgsConstructor @AllArgsConstructor
public class Place {
    @Id @Column(name = "id", length = 64) private String id;
    @Column(name = "name", nullable = false, length = 256) private String name;
    @Column(name = "latitude") private Double latitude;
    @Column(name = "longitude") private Double longitude;

    public boolean hasLocation() { return latitude != null && longitude != null; }
}
