package com.firmenakte.aggregate.service;

import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.config.AggregatorProperties;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Locally maintained list of known companies ({@code company_name,registernummer,ust_idnr}). Used to
 * fill in a VAT id the caller did not supply.
 */
@Component
public class CompanyDirectory {
    private static final Logger log = LoggerFactory.getLogger(CompanyDirectory.class);

    private final AggregatorProperties properties;
    private volatile List<Entry> entries;

    public CompanyDirectory(AggregatorProperties properties) {
        this.properties = properties;
    }

    public Optional<String> findUstIdnr(CompanyIdentity identity) {
        String name = normalizeName(identity.companyName());
        String register = normalizeRegister(identity.registernummer());
        if (name == null && register == null) {
            return Optional.empty();
        }
        for (Entry entry : entries()) {
            if (entry.ustIdnr() == null) {
                continue;
            }
            boolean nameMatches = name == null || name.equals(entry.name());
            boolean registerMatches = register == null || register.equals(entry.register());
            if (nameMatches && registerMatches) {
                log.info("Found USt-IdNr for {} in company directory", identity.displayName());
                return Optional.of(entry.ustIdnr());
            }
        }
        return Optional.empty();
    }

    public void reload() {
        entries = load();
    }

    private List<Entry> entries() {
        List<Entry> current = entries;
        if (current == null) {
            synchronized (this) {
                if (entries == null) {
                    entries = load();
                }
                current = entries;
            }
        }
        return current;
    }

    private List<Entry> load() {
        String configured = properties.getData().getCompaniesCsv();
        if (configured == null || configured.isBlank()) {
            return List.of();
        }
        Path path = Paths.get(configured);
        if (!Files.isRegularFile(path)) {
            log.info("Company directory {} not found; USt-IdNr lookup disabled", path);
            return List.of();
        }
        List<Entry> loaded = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                String name = normalizeName(getColumn(record, "company_name", "name"));
                String register = normalizeRegister(getColumn(record, "registernummer", "hrb"));
                String ust = getColumn(record, "ust_idnr", "ust-idnr", "vat_id");
                if (name == null && register == null) {
                    log.debug("Company directory row {} has neither name nor register number", record.getRecordNumber());
                    continue;
                }
                loaded.add(new Entry(name, register, ust == null ? null : ust.replace(" ", "").toUpperCase(Locale.ROOT)));
            }
        } catch (IOException e) {
            log.warn("Unable to read company directory {}", path, e);
            return List.of();
        }
        log.info("Loaded {} companies from {}", loaded.size(), path);
        return List.copyOf(loaded);
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    private static String normalizeName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    // "HRB 182742" and "182742" refer to the same entry
    private static String normalizeRegister(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String digits = value.replace(" ", "").toUpperCase(Locale.ROOT).replaceFirst("^HR[AB]", "");
        return digits.isEmpty() ? null : digits;
    }

    private record Entry(String name, String register, String ustIdnr) {
    }
}
