package com.infomedia.abacox.pnrquality.db.repository;

import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.projection.ContactSignalRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

public interface ContactRepository extends JpaRepository<Contact, Long> {

    List<Contact> findByPnrIdOrderById(Long pnrId);

    List<Contact> findByPnrIdIn(Collection<Long> pnrIds);

    @Query("SELECT c.pnrId AS pnrId, c.contactType AS contactType, c.contactDetail AS contactDetail FROM Contact c")
    Stream<ContactSignalRow> streamSignalRows();
}
