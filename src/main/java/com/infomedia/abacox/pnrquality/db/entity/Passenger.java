package com.infomedia.abacox.pnrquality.db.entity;

import com.infomedia.abacox.pnrquality.db.entity.superclass.AuditedEntity;
import com.infomedia.abacox.pnrquality.component.scoring.PassengerLine;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.SuperBuilder;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(
    name = "passenger",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_passenger_identity", columnNames = {"pnr_id", "surname", "first_name"})
    },
    indexes = {
        @Index(name = "idx_passenger_pnr", columnList = "pnr_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@SuperBuilder(toBuilder = true)
public class Passenger extends AuditedEntity implements PassengerLine {
    public static final int SURNAME_LENGTH = 100;
    public static final int FIRST_NAME_LENGTH = 100;
    public static final int FF_NUMBER_LENGTH = 30;
    public static final int MEAL_LENGTH = 10;
    public static final int SEAT_ROW_NUMBER_LENGTH = 5;
    public static final int SEAT_COLUMN_LENGTH = 5;

    @Id
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "passenger_id_seq")
    @SequenceGenerator(name = "passenger_id_seq", sequenceName = "passenger_id_seq", allocationSize = 50)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "pnr_id", nullable = false)
    private Long pnrId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pnr_id", insertable = false, updatable = false, foreignKey = @ForeignKey(name = "fk_passenger_pnr"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Pnr pnr;

    @Column(name = "surname", length = SURNAME_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String surname = "";

    @Column(name = "first_name", length = FIRST_NAME_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String firstName = "";

    @Column(name = "ff_number", length = FF_NUMBER_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String ffNumber = "";

    @Column(name = "meal", length = MEAL_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String meal = "";

    @Column(name = "seat_row_number", length = SEAT_ROW_NUMBER_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String seatRowNumber = "";

    @Column(name = "seat_column", length = SEAT_COLUMN_LENGTH, nullable = false)
    @ColumnDefault("''")
    @Builder.Default
    private String seatColumn = "";

    /**
     * Row and column joined, or an empty string unless both are present.
     */
    @Transient
    public String getSeat() {
        if (seatRowNumber == null || seatRowNumber.isBlank() || seatColumn == null || seatColumn.isBlank()) {
            return "";
        }
        return seatRowNumber.trim() + seatColumn.trim();
    }
}
