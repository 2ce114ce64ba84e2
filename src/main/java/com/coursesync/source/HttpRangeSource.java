package com.coursesync.source;

import com.coursesync.error.CancelledException;
import com.coursesync.error.FetchException;
import com.coursesync.util.StopSignal;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

/**
 * Remote file read through HTTP range requests.
 * <p>
 * A range request must be answered with {@code 206 Partial Content}; a server that
 * answers {@code 200} ignored the range and would send the whole file, which defeats
 * window fingerprinting, so that is a non-retryable failure. {@code 416} means the
 * range starts past the end of the resource and yields an empty slice.
 */
public class HttpRangeSource implements ByteRangeSource {

    private final OkHttpClient client;
    private final HttpUrl url;

    public HttpRangeSource(OkHttpClient client, HttpUrl url) {
        if (client == null || url == null) {
            throw new IllegalArgumentException("client and url are required");
        }
        this.client = client;
        this.url = url;
    }

    public HttpUrl url() {
        return url;
    }

    @Override
    public RangeSlice fetchRange(long offset, int length, StopSignal stop) throws IOException {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + offset);
        }
        if (length <= 0) {
            throw new IllegalArgumentException("Length must be positive: " + length);
        }
        stop.throwIfStopped("range request to " + url);

        String rangeHeader = "bytes=" + offset + "-" + (offset + length - 1);
        Request request = new Request.Builder()
                .url(url)
                .header("Range", rangeHeader)
                .build();

        Call call = client.newCall(request);
        try (StopSignal.Registration ignored = stop.onStop(call::cancel);
             Response response = call.execute()) {
            return toSlice(response, offset, length, rangeHeader);
        } catch (FetchException | CancelledException e) {
            throw e;
        } catch (IOException e) {
            throw translate(e, stop, "Range request " + rangeHeader + " to " + url + " failed");
        }
    }

    @Override
    public InputStream openFull(StopSignal stop) throws IOException {
        stop.throwIfStopped("download of " + url);

        Call call = client.newCall(new Request.Builder().url(url).build());
        StopSignal.Registration registration = stop.onStop(call::cancel);
        Response response = null;
        try {
            response = call.execute();
            if (!response.isSuccessful()) {
                throw statusFailure(response.code(), "GET " + url);
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new FetchException("Response body is null for " + url, true);
            }
            return new ResponseInputStream(body.byteStream(), response, registration);
        } catch (IOException e) {
            if (response != null) {
                response.close();
            }
            registration.close();
            if (e instanceof FetchException || e instanceof CancelledException) {
                throw e;
            }
            throw translate(e, stop, "GET " + url + " failed");
        }
    }

    @Override
    public String describe() {
        return url.toString();
    }

    private RangeSlice toSlice(Response response, long offset, int length, String rangeHeader) throws IOException {
        int code = response.code();
        String contentRange = response.header("Content-Range");

        if (code == 416) {
            return RangeSlice.empty(offset, parseTotal(contentRange));
        }
        if (code == 200) {
            throw new FetchException("Server ignored " + rangeHeader + " for " + url
                    + " and answered with the full content", false);
        }
        if (code != 206) {
            throw statusFailure(code, "Range request " + rangeHeader + " to " + url);
        }

        long start = parseStart(contentRange);
        if (start >= 0 && start != offset) {
            throw new FetchException("Server answered " + rangeHeader + " with Content-Range " + contentRange, false);
        }

        ResponseBody body = response.body();
        if (body == null) {
            throw new FetchException("No response body for " + rangeHeader + " to " + url, true);
        }
        byte[] data = body.bytes();
        if (data.length > length) {
            data = Arrays.copyOf(data, length);
        }

        long total = parseTotal(contentRange);
        if (total >= 0) {
            long expected = Math.max(0, Math.min(offset + length, total) - offset);
            if (data.length < expected) {
                throw new FetchException("Short response for " + rangeHeader + " to " + url
                        + ": expected " + expected + " bytes but received " + data.length, true);
            }
        }
        return new RangeSlice(offset, data, total);
    }

    static FetchException statusFailure(int code, String what) {
        boolean retryable = code >= 500 || code == 429 || code == 408;
        return new FetchException(what + " failed with HTTP " + code, retryable);
    }

    static IOException translate(IOException e, StopSignal stop, String message) {
        if (stop.isStopped()) {
            return new CancelledException("Cancelled: " + message, e);
        }
        return new FetchException(message + ": " + e.getMessage(), e, true);
    }

    /**
     * Total length from {@code bytes 0-99/1234} or {@code bytes *}{@code /1234}, {@code -1} if unknown.
     */
    static long parseTotal(String contentRange) {
        if (contentRange == null) {
            return -1;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0) {
            return -1;
        }
        String total = contentRange.substring(slash + 1).trim();
        try {
            return total.equals("*") ? -1 : Long.parseLong(total);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * First byte position from {@code bytes 0-99/1234}, {@code -1} if absent.
     */
    static long parseStart(String contentRange) {
        if (contentRange == null) {
            return -1;
        }
        String value = contentRange.trim();
        if (value.startsWith("bytes")) {
            value = value.substring(5).trim();
        }
        int dash = value.indexOf('-');
        if (dash <= 0) {
            return -1;
        }
        try {
            return Long.parseLong(value.substring(0, dash).trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * Body stream that releases the response and the stop hook when closed.
     */
    private static final class ResponseInputStream extends FilterInputStream {

        private final Response response;
        private final StopSignal.Registration registration;

        ResponseInputStream(InputStream in, Response response, StopSignal.Registration registration) {
            super(in);
            this.response = response;
            this.registration = registration;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                response.close();
                registration.close();
            }
        }
    }
}
