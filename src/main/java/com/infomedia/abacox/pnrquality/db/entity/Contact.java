package com.infomedia.abacox.pnrquality.db.entity;

import com.infomedia.abacox.pnrquality.db.entity.superclass.AuditedEntity;
import com.infomedia.abacox.pnrquality.component.scoring.ContactLine;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * Raw contact line of a PNR. The declared type is kept as received; email/phone verdicts
 * are derived by the classifier and never stored.
 */
@Entity
@Table(
    name = "contact",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_contact_identity", columnNames = {"pnr_id", "contact_type", "contact_detail"})
    },
    indexes = {
        @Index(name = "idx_contact_pnr", columnList = "pnr_id"),
        @Index(name = "idx_contact_type_detail", columnList = "contact_type, contact_detail")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class Contact extends AuditedEntity implements ContactLine {
    public static final int CONTACT_TYPE_LENGTH = 20;
    public static final int CONTACT_DETAIL_LENGTH = 200;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "contact_id_seq")
    @SequenceGenerator(name = "contact_id_seq", sequenceName = "contact_id_seq", allocationSize = 50)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "pnr_id", nullable = false)
    private Long pnrId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pnr_id", insertable = false, updatable = false, foreignKey = @ForeignKey(name = "fk_contact_pnr"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Pnr pnr;

    @Column(name = "contact_type", length = CONTACT_TYPE_LENGTH, nullable = false)
    private String contactType;

    @Column(name = "contact_detail", length = CONTACT_DETAIL_LENGTH, nullable = false)
    private String contactDetail;
}
