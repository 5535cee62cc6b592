package com.infomedia.abacox.pnrquality.db.repository;

import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import com.infomedia.abacox.pnrquality.db.projection.PnrDimensionRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public interface PnrRepository extends JpaRepository<Pnr, Long>, JpaSpecificationExecutor<Pnr> {

    Optional<Pnr> findByControlNumber(String controlNumber);

    boolean existsByControlNumber(String controlNumber);

    List<Pnr> findByControlNumberIn(Collection<String> controlNumbers);

    /**
     * Streams the dimension attributes of every PNR. Must be consumed inside a transaction
     * and closed.
     */
    @Query("""
        SELECT p.id AS id, p.controlNumber AS controlNumber, p.officeId AS officeId, p.agent AS agent,
               p.deliverySystemCompany AS deliverySystemCompany,
               p.deliverySystemLocation AS deliverySystemLocation, p.creationDate AS creationDate
        FROM Pnr p
        ORDER BY p.id
        """)
    Stream<PnrDimensionRow> streamDimensions();

    @Query("""
        SELECT DISTINCT p.deliverySystemCompany FROM Pnr p
        WHERE p.deliverySystemCompany <> ''
        ORDER BY p.deliverySystemCompany
        """)
    List<String> findDistinctDeliverySystems();

    @Query("""
        SELECT DISTINCT p.officeId FROM Pnr p
        WHERE p.officeId <> ''
        ORDER BY p.officeId
        """)
    List<String> findDistinctOffices();

    @Query("""
        SELECT DISTINCT p.officeId FROM Pnr p
        WHERE p.officeId <> '' AND p.deliverySystemCompany IN :deliverySystems
        ORDER BY p.officeId
        """)
    List<String> findDistinctOfficesByDeliverySystems(@Param("deliverySystems") Collection<String> deliverySystems);
}
