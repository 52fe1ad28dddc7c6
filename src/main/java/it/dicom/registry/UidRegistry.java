package it.dicom.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class UidRegistry {

    private final Map<String, DicomUid> uids;

    private UidRegistry(Map<String, DicomUid> uids) {
        this.uids = Collections.unmodifiableMap(new LinkedHashMap<>(uids));
    }

    public static Builder builder() {
        return new Builder();
    }

    public DicomUid lookup(String uid) {
        String trimmed = trimPadding(uid);
        DicomUid known = uids.get(trimmed);
        return known != null ? known : DicomUid.unknown(trimmed);
    }

    public Optional<DicomUid> find(String uid) {
        return Optional.ofNullable(uids.get(trimPadding(uid)));
    }

    public boolean isKnown(String uid) {
        return uids.containsKey(trimPadding(uid));
    }

    public Collection<DicomUid> enumerate() {
        return uids.values();
    }

    public List<DicomUid> transferSyntaxes() {
        return uids.values().stream()
            .filter(DicomUid::isTransferSyntax)
            .toList();
    }

    public int size() {
        return uids.size();
    }

    public static boolean isValid(String uid) {
        if (uid == null || uid.isEmpty()) {
            return false;
        }
        for (int i = 0; i < uid.length(); i++) {
            char c = uid.charAt(i);
            if (c != '.' && (c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }

    private static String trimPadding(String uid) {
        int end = uid.length();
        while (end > 0 && (uid.charAt(end - 1) == ' ' || uid.charAt(end - 1) == '\0')) {
            end--;
        }
        return uid.substring(0, end);
    }

    public static final class Builder {

        private final Map<String, DicomUid> uids = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(DicomUid uid) {
            if (uids.putIfAbsent(uid.uid(), uid) != null) {
                throw new IllegalArgumentException("UID registered twice: " + uid.uid());
            }
            return this;
        }

        public Builder register(String uid, String name, DicomUidType type) {
            return register(new DicomUid(uid, name, type, false));
        }

        public UidRegistry build() {
            return new UidRegistry(uids);
        }
    }
}
