package it.dicom.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import it.dicom.service.PduModels.PDataTf;
import it.dicom.service.PduModels.PresentationDataValue;

public final class PdvFragmenter {

    // item length, context ID and message control header
    public static final int PDV_OVERHEAD = 6;
    public static final int DEFAULT_MAX_PDU_LENGTH = 16384;

    private PdvFragmenter() {
    }

    // 0 means unlimited on either side
    public static int effectiveMaxPduLength(long localMax, long peerMax) {
        long effective;
        if (localMax == 0 && peerMax == 0) {
            effective = DEFAULT_MAX_PDU_LENGTH;
        } else if (localMax == 0) {
            effective = peerMax;
        } else if (peerMax == 0) {
            effective = localMax;
        } else {
            effective = Math.min(localMax, peerMax);
        }
        return (int) Math.min(effective, Integer.MAX_VALUE - PduCodec.HEADER_LENGTH);
    }

    public static boolean isUsableMaxPduLength(long peerMax) {
        return peerMax == 0 || peerMax > PDV_OVERHEAD;
    }

    public static List<PDataTf> fragment(int presentationContextId, byte[] command, byte[] dataSet, int maxPduLength) {
        if (maxPduLength <= PDV_OVERHEAD) {
            throw new IllegalArgumentException("Maximum PDU length " + maxPduLength + " leaves no room for PDV payload");
        }
        Packer packer = new Packer(presentationContextId, maxPduLength);
        packer.add(command, true);
        if (dataSet != null) {
            packer.add(dataSet, false);
        }
        return packer.finish();
    }

    public static byte[] reassemble(List<PDataTf> pdus, boolean command) {
        int length = 0;
        List<byte[]> parts = new ArrayList<>();
        for (PDataTf pdu : pdus) {
            for (PresentationDataValue pdv : pdu.values()) {
                if (pdv.command() == command) {
                    parts.add(pdv.data());
                    length += pdv.data().length;
                }
            }
        }
        byte[] out = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }

    private static final class Packer {

        private final int presentationContextId;
        private final int maxPduLength;
        private final List<PDataTf> pdus = new ArrayList<>();
        private List<PresentationDataValue> current = new ArrayList<>();
        private int used;

        private Packer(int presentationContextId, int maxPduLength) {
            this.presentationContextId = presentationContextId;
            this.maxPduLength = maxPduLength;
        }

        void add(byte[] bytes, boolean command) {
            int offset = 0;
            do {
                int room = maxPduLength - used - PDV_OVERHEAD;
                if (room <= 0) {
                    flush();
                    room = maxPduLength - PDV_OVERHEAD;
                }
                int chunk = Math.min(room, bytes.length - offset);
                boolean last = offset + chunk == bytes.length;
                current.add(new PresentationDataValue(presentationContextId, command, last, Arrays.copyOfRange(bytes, offset, offset + chunk)));
                used += PDV_OVERHEAD + chunk;
                offset += chunk;
            } while (offset < bytes.length);
        }

        List<PDataTf> finish() {
            flush();
            return pdus;
        }

        private void flush() {
            if (!current.isEmpty()) {
                pdus.add(new PDataTf(current));
                current = new ArrayList<>();
                used = 0;
            }
        }
    }
}
