package com.infomedia.abacox.pnrquality.db.repository;

import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import com.infomedia.abacox.pnrquality.db.projection.PassengerSignalRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

public interface PassengerRepository extends JpaRepository<Passenger, Long> {

    List<Passenger> findByPnrIdOrderById(Long pnrId);

    List<Passenger> findByPnrIdIn(Collection<Long> pnrIds);

    @Query("""
        SELECT p.pnrId AS pnrId, p.ffNumber AS ffNumber, p.meal AS meal,
               p.seatRowNumber AS seatRowNumber, p.seatColumn AS seatColumn
        FROM Passenger p
        """)
    Stream<PassengerSignalRow> streamSignalRows();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE Passenger p SET p.meal = :to WHERE p.meal = :from")
    int updateMeal(@Param("from") String from, @Param("to") String to);
}
