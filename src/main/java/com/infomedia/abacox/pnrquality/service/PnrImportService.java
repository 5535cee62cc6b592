package com.infomedia.abacox.pnrquality.service;

import com.infomedia.abacox.pnrquality.component.importing.ContactKey;
import com.infomedia.abacox.pnrquality.component.importing.ImportBatch;
import com.infomedia.abacox.pnrquality.component.importing.PassengerKey;
import com.infomedia.abacox.pnrquality.component.importing.PnrImportRow;
import com.infomedia.abacox.pnrquality.component.importing.PnrRowImporter;
import com.infomedia.abacox.pnrquality.db.entity.Contact;
import com.infomedia.abacox.pnrquality.db.entity.Passenger;
import com.infomedia.abacox.pnrquality.db.entity.Pnr;
import com.infomedia.abacox.pnrquality.db.repository.ContactRepository;
import com.infomedia.abacox.pnrquality.db.repository.PassengerRepository;
import com.infomedia.abacox.pnrquality.db.repository.PnrRepository;
import com.infomedia.abacox.pnrquality.dto.importing.ImportResult;
import com.infomedia.abacox.pnrquality.dto.pnr.CreatePnr;
import com.infomedia.abacox.pnrquality.service.exception.DuplicateControlNumberException;
import com.infomedia.abacox.pnrquality.service.exception.InvalidControlNumberException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.infomedia.abacox.pnrquality.config.CachingConfig.DELIVERY_SYSTEMS;
import static com.infomedia.abacox.pnrquality.config.CachingConfig.OFFICES;
import static com.infomedia.abacox.pnrquality.config.CachingConfig.QUALITY_SUMMARY;

@Service
@Log4j2
@RequiredArgsConstructor
public class PnrImportService {

    private final PnrRepository pnrRepository;
    private final PassengerRepository passengerRepository;
    private final ContactRepository contactRepository;
    private final Validator validator;

    /**
     * Replaces the whole dataset with the given rows. Runs in one transaction: the previous
     * data is only gone if the new data was written.
     */
    @Transactional
    @CacheEvict(cacheNames = {QUALITY_SUMMARY, DELIVERY_SYSTEMS, OFFICES}, allEntries = true)
    public ImportResult importRows(Collection<PnrImportRow> rows) {
        long start = System.currentTimeMillis();
        ImportBatch batch = PnrRowImporter.deduplicate(rows);

        contactRepository.deleteAllInBatch();
        passengerRepository.deleteAllInBatch();
        pnrRepository.deleteAllInBatch();

        List<Pnr> saved = pnrRepository.saveAll(batch.getPnrs().values());
        Map<String, Long> idsByControlNumber = saved.stream()
                .collect(Collectors.toMap(Pnr::getControlNumber, Pnr::getId));

        List<Passenger> passengers = attachPassengers(batch.getPassengers(), idsByControlNumber);
        List<Contact> contacts = attachContacts(batch.getContacts(), idsByControlNumber);
        passengerRepository.saveAll(passengers);
        contactRepository.saveAll(contacts);

        ImportResult result = toResult(batch, saved.size(), passengers.size(), contacts.size());
        log.info("Imported {} PNRs, {} passengers, {} contacts from {} rows in {} ms ({} rows skipped)",
                result.getPnrCount(), result.getPassengerCount(), result.getContactCount(),
                rows.size(), System.currentTimeMillis() - start, result.getSkippedRows());
        return result;
    }

    /**
     * Merges the rows into the stored data: existing PNRs get their non-blank attributes
     * updated, new PNRs are created, and only passengers and contacts not stored yet are added.
     */
    @Transactional
    @CacheEvict(cacheNames = {QUALITY_SUMMARY, DELIVERY_SYSTEMS, OFFICES}, allEntries = true)
    public ImportResult upsertRows(Collection<PnrImportRow> rows) {
        ImportBatch batch = PnrRowImporter.deduplicate(rows);

        Map<String, Pnr> existing = pnrRepository.findByControlNumberIn(batch.getPnrs().keySet()).stream()
                .collect(Collectors.toMap(Pnr::getControlNumber, Function.identity()));

        List<Pnr> toSave = new ArrayList<>();
        for (Pnr incoming : batch.getPnrs().values()) {
            Pnr stored = existing.get(incoming.getControlNumber());
            if (stored == null) {
                toSave.add(incoming);
            } else {
                mergeAttributes(stored, incoming);
                toSave.add(stored);
            }
        }
        List<Pnr> saved = pnrRepository.saveAll(toSave);
        Map<String, Long> idsByControlNumber = saved.stream()
                .collect(Collectors.toMap(Pnr::getControlNumber, Pnr::getId));
        Map<Long, String> controlNumbersById = saved.stream()
                .collect(Collectors.toMap(Pnr::getId, Pnr::getControlNumber));

        Set<PassengerKey> storedPassengers = new HashSet<>();
        Set<ContactKey> storedContacts = new HashSet<>();
        if (!existing.isEmpty()) {
            List<Long> existingIds = existing.values().stream().map(Pnr::getId).toList();
            passengerRepository.findByPnrIdIn(existingIds).forEach(p -> storedPassengers.add(
                    new PassengerKey(controlNumbersById.get(p.getPnrId()), p.getSurname(), p.getFirstName())));
            contactRepository.findByPnrIdIn(existingIds).forEach(c -> storedContacts.add(
                    new ContactKey(controlNumbersById.get(c.getPnrId()), c.getContactType(), c.getContactDetail())));
        }
        storedPassengers.forEach(batch.getPassengers()::remove);
        storedContacts.forEach(batch.getContacts()::remove);

        List<Passenger> passengers = attachPassengers(batch.getPassengers(), idsByControlNumber);
        List<Contact> contacts = attachContacts(batch.getContacts(), idsByControlNumber);
        passengerRepository.saveAll(passengers);
        contactRepository.saveAll(contacts);

        ImportResult result = toResult(batch, saved.size(), passengers.size(), contacts.size());
        result.setDuplicatePassengers(result.getDuplicatePassengers() + storedPassengers.size());
        result.setDuplicateContacts(result.getDuplicateContacts() + storedContacts.size());
        log.info("Merged {} PNRs ({} new), added {} passengers and {} contacts from {} rows",
                saved.size(), saved.size() - existing.size(), passengers.size(), contacts.size(), rows.size());
        return result;
    }

    /**
     * Creates a single PNR. A blank or over-long control number fails with
     * {@link InvalidControlNumberException}, any other constraint of {@link CreatePnr} with
     * {@link ConstraintViolationException}.
     */
    @Transactional
    @CacheEvict(cacheNames = {QUALITY_SUMMARY, DELIVERY_SYSTEMS, OFFICES}, allEntries = true)
    public Pnr createPnr(CreatePnr cDto) {
        String controlNumber = cDto.getControlNumber() == null ? "" : cDto.getControlNumber().trim();
        if (controlNumber.isEmpty()) {
            throw new InvalidControlNumberException("Control number must not be blank");
        }
        if (controlNumber.length() > Pnr.CONTROL_NUMBER_LENGTH) {
            throw new InvalidControlNumberException("Control number " + controlNumber + " is longer than "
                    + Pnr.CONTROL_NUMBER_LENGTH + " characters");
        }
        Set<ConstraintViolation<CreatePnr>> violations = validator.validate(cDto).stream()
                .filter(violation -> !violation.getPropertyPath().toString().equals("controlNumber"))
                .collect(Collectors.toSet());
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        if (pnrRepository.existsByControlNumber(controlNumber)) {
            throw new DuplicateControlNumberException("PNR " + controlNumber + " already exists");
        }
        Pnr pnr = Pnr.builder()
                .controlNumber(controlNumber)
                .officeId(orEmpty(cDto.getOfficeId()))
                .agent(orEmpty(cDto.getAgent()))
                .deliverySystemCompany(orEmpty(cDto.getDeliverySystemCompany()))
                .deliverySystemLocation(orEmpty(cDto.getDeliverySystemLocation()))
                .creationDate(cDto.getCreationDate())
                .build();
        return pnrRepository.save(pnr);
    }

    private static void mergeAttributes(Pnr stored, Pnr incoming) {
        if (!incoming.getOfficeId().isEmpty()) stored.setOfficeId(incoming.getOfficeId());
        if (!incoming.getAgent().isEmpty()) stored.setAgent(incoming.getAgent());
        if (!incoming.getDeliverySystemCompany().isEmpty()) stored.setDeliverySystemCompany(incoming.getDeliverySystemCompany());
        if (!incoming.getDeliverySystemLocation().isEmpty()) stored.setDeliverySystemLocation(incoming.getDeliverySystemLocation());
        if (incoming.getCreationDate() != null) stored.setCreationDate(incoming.getCreationDate());
    }

    private static List<Passenger> attachPassengers(Map<PassengerKey, Passenger> passengers, Map<String, Long> pnrIds) {
        List<Passenger> attached = new ArrayList<>(passengers.size());
        passengers.forEach((key, passenger) -> {
            passenger.setPnrId(pnrIds.get(key.controlNumber()));
            attached.add(passenger);
        });
        return attached;
    }

    private static List<Contact> attachContacts(Map<ContactKey, Contact> contacts, Map<String, Long> pnrIds) {
        List<Contact> attached = new ArrayList<>(contacts.size());
        contacts.forEach((key, contact) -> {
            contact.setPnrId(pnrIds.get(key.controlNumber()));
            attached.add(contact);
        });
        return attached;
    }

    private static ImportResult toResult(ImportBatch batch, int pnrs, int passengers, int contacts) {
        return ImportResult.builder()
                .pnrCount(pnrs)
                .passengerCount(passengers)
                .contactCount(contacts)
                .processedRows(batch.getProcessedRows())
                .skippedRows(batch.getSkippedRows())
                .duplicatePassengers(batch.getDuplicatePassengers())
                .duplicateContacts(batch.getDuplicateContacts())
                .build();
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
