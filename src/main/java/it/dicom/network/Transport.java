package it.dicom.network;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

public interface Transport extends Closeable {

    InputStream input() throws IOException;

    OutputStream output() throws IOException;

    String remoteAddress();

    boolean isOpen();

    @Override
    void close();
}
