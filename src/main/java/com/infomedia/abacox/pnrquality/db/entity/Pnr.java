package com.infomedia.abacox.pnrquality.db.entity;

import com.infomedia.abacox.pnrquality.db.entity.superclass.AuditedEntity;
import com.infomedia.abacox.pnrquality.component.filter.PnrAttributes;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Passenger Name Record, the root entity of a booking.
 * Contacts and passengers reference it through {@code pnr_id} and are removed with it.
 */
@Entity
@Table(
    name = "pnr",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_pnr_control_number", columnNames = "control_number")
    },
    indexes = {
        @Index(name = "idx_pnr_office", columnList = "office_id"),
        @Index(name = "idx_pnr_creation_date", columnList = "creation_date"),
        @Index(name = "idx_pnr_delivery_company", columnList = "delivery_system_company"),
        // Dashboard filters: date range + office, delivery system + date range
        @Index(name = "idx_pnr_creation_office", columnList = "creation_date, office_id"),
        @Index(name = "idx_pnr_delivery_creation", columnList = "delivery_system_company, creation_date")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class Pnr extends AuditedEntity implements PnrAttributes {
    public static final int CONTROL_NUMBER_LENGTH = 20;
    public static final int OFFICE_ID_LENGTH = 20;
    public static final int AGENT_LENGTH = 50;
    public static final int DELIVERY_SYSTEM_COMPANY_LENGTH = 10;
    public static final int DELIVERY_SYSTEM_LOCATION_LENGTH = 10;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "pnr_id_seq")
    @SequenceGenerator(name = "pnr_id_seq", sequenceName = "pnr_id_seq", allocationSize = 50)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "control_number", length = CONTROL_NUMBER_LENGTH, nullable = false)
    private String controlNumber;

    @Column(name = "office_id", length = OFFICE_ID_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String officeId = "";

    @Column(name = "agent", length = AGENT_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String agent = "";

    @Column(name = "creation_date")
    private LocalDate creationDate;

    @Column(name = "delivery_system_company", length = DELIVERY_SYSTEM_COMPANY_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String deliverySystemCompany = "";

    @Column(name = "delivery_system_location", length = DELIVERY_SYSTEM_LOCATION_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String deliverySystemLocation = "";

    @OneToMany(mappedBy = "pnr", cascade = CascadeType.REMOVE)
    @Builder.Default
    private List<Contact> contacts = new ArrayList<>();

    @OneToMany(mappedBy = "pnr", cascade = CascadeType.REMOVE)
    @Builder.Default
    private List<Passenger> passengers = new ArrayList<>();
}
