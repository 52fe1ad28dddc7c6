package it.dicom.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.util.StringUtils;

import it.dicom.registry.DicomUidType;
import it.dicom.registry.UidRegistry;

public final class TransferSyntaxPolicy {

    public static final String ANY_SOP_CLASS = "*";

    private final Map<String, List<String>> supported;
    private final UidRegistry registry;

    private TransferSyntaxPolicy(Map<String, List<String>> supported, UidRegistry registry) {
        this.supported = supported;
        this.registry = registry;
    }

    public static TransferSyntaxPolicy of(Map<String, List<String>> supported, UidRegistry registry) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        supported.forEach((abstractSyntax, transferSyntaxes) -> copy.put(abstractSyntax, List.copyOf(transferSyntaxes)));
        return new TransferSyntaxPolicy(java.util.Collections.unmodifiableMap(copy), registry);
    }

    public static TransferSyntaxPolicy parse(String table, UidRegistry registry) {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        if (!StringUtils.hasText(table)) {
            return of(entries, registry);
        }
        for (String row : table.split(";")) {
            if (!StringUtils.hasText(row)) {
                continue;
            }
            if (!row.contains("->")) {
                throw new IllegalArgumentException("Transfer-syntax policy row without '->': " + row.trim());
            }
            String[] parts = row.split("->", 2);
            String abstractSyntax = parts[0].trim();
            List<String> transferSyntaxes = new ArrayList<>();
            for (String transferSyntax : parts[1].split("\\|")) {
                if (StringUtils.hasText(transferSyntax)) {
                    transferSyntaxes.add(transferSyntax.trim());
                }
            }
            if (transferSyntaxes.isEmpty()) {
                throw new IllegalArgumentException("No transfer syntax listed for " + abstractSyntax);
            }
            entries.merge(abstractSyntax, transferSyntaxes, (left, right) -> {
                List<String> merged = new ArrayList<>(left);
                right.stream().filter(ts -> !merged.contains(ts)).forEach(merged::add);
                return merged;
            });
        }
        return of(entries, registry);
    }

    public Optional<List<String>> transferSyntaxesFor(String abstractSyntax) {
        List<String> explicit = supported.get(abstractSyntax);
        if (explicit != null) {
            return Optional.of(explicit);
        }
        List<String> wildcard = supported.get(ANY_SOP_CLASS);
        if (wildcard != null && registry.find(abstractSyntax).map(uid -> uid.type() == DicomUidType.SOP_CLASS).orElse(false)) {
            return Optional.of(wildcard);
        }
        return Optional.empty();
    }

    public Map<String, List<String>> entries() {
        return supported;
    }
}
