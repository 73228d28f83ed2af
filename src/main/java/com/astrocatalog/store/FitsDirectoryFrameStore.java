package com.astrocatalog.store;

import com.astrocatalog.model.CaptureKind;
import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catálogo leído directamente de una carpeta de ficheros FITS. Las cabeceras ya leídas se guardan
 * mientras el fichero no cambie (tamaño y fecha de modificación).
 */
public class FitsDirectoryFrameStore implements FrameStore {

    private static final Logger logger = LoggerFactory.getLogger(FitsDirectoryFrameStore.class);

    // Las sesiones nocturnas cruzan la medianoche: restamos 12h antes de tomar la fecha
    static final int DATE_OFFSET_HOURS = 12;

    private static final String[] TEMPERATURE_KEYS = {"CCD-TEMP", "TEMPERAT", "CCD_TEMP", "SET-TEMP", "CCDTEMP"};
    private static final String[] EXPOSURE_KEYS = {"EXPTIME", "EXPOSURE"};
    private static final String[] DATE_KEYS = {"DATE-LOC", "DATE-OBS"};

    private final Path directory;
    private final boolean recursive;
    private final Map<Path, CachedFrame> headerCache = new ConcurrentHashMap<>();

    public FitsDirectoryFrameStore(Path directory, boolean recursive) {
        this.directory = directory;
        this.recursive = recursive;
    }

    @Override
    public List<Frame> findLightFrames(DateRange range) throws FrameStoreException {
        List<Frame> out = new ArrayList<>();
        for (Frame f : scan()) {
            if (f.kind == CaptureKind.LIGHT && InMemoryFrameStore.inRange(f, range)) out.add(f);
        }
        return out;
    }

    @Override
    public List<Frame> findCalibrationFrames(DateRange range) throws FrameStoreException {
        List<Frame> out = new ArrayList<>();
        for (Frame f : scan()) {
            if (!f.kind.isCalibration()) continue;
            if (f.kind == CaptureKind.FLAT && !InMemoryFrameStore.inRange(f, range)) continue;
            out.add(f);
        }
        return out;
    }

    private List<Frame> scan() throws FrameStoreException {
        if (!Files.isDirectory(directory)) {
            throw new FrameStoreException("La carpeta del catálogo no existe: " + directory);
        }
        List<Path> files;
        try (Stream<Path> s = recursive ? Files.walk(directory) : Files.list(directory)) {
            files = s.filter(Files::isRegularFile).filter(FitsDirectoryFrameStore::isFits).sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new FrameStoreException("No se pudo listar " + directory, e);
        }

        List<Frame> frames = new ArrayList<>(files.size());
        int skipped = 0;
        for (Path p : files) {
            Frame f = readCached(p);
            if (f != null) frames.add(f);
            else skipped++;
        }
        if (skipped > 0) {
            logger.warn("{} ficheros FITS de {} sin tipo de imagen reconocible o ilegibles", skipped, directory);
        }
        return frames;
    }

    private Frame readCached(Path p) {
        File file = p.toFile();
        long size = file.length();
        long modified = file.lastModified();
        CachedFrame cached = headerCache.get(p);
        if (cached != null && cached.size == size && cached.modified == modified) return cached.frame;

        Frame f = readFrame(p);
        headerCache.put(p, new CachedFrame(f, size, modified));
        return f;
    }

    Frame readFrame(Path p) {
        try (Fits fits = new Fits(p.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) return null;
            return toFrame(directory.relativize(p).toString().replace(File.separatorChar, '/'), hdu.getHeader());
        } catch (Exception e) {
            logger.warn("No se pudo leer la cabecera de {}: {}", p, e.getMessage());
            return null;
        }
    }

    static Frame toFrame(String id, Header header) {
        String imageType = string(header, "IMAGETYP");
        CaptureKind kind = CaptureKind.fromImageType(imageType);
        if (kind == null) return null;

        return Frame.builder(id, kind)
                .master(CaptureKind.isMasterImageType(imageType))
                .object(string(header, "OBJECT"))
                .filter(string(header, "FILTER"))
                .exposure(firstDouble(header, EXPOSURE_KEYS))
                .temperature(firstDouble(header, TEMPERATURE_KEYS))
                .binning(header.getIntValue("XBINNING", 1), header.getIntValue("YBINNING", 1))
                .date(sessionDate(header))
                .instrument(string(header, "INSTRUME"))
                .build();
    }

    private static String string(Header header, String key) {
        if (!header.containsKey(key)) return null;
        String v = header.getStringValue(key);
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static Double firstDouble(Header header, String[] keys) {
        for (String k : keys) {
            if (header.containsKey(k)) return header.getDoubleValue(k);
        }
        return null;
    }

    private static LocalDate sessionDate(Header header) {
        for (String k : DATE_KEYS) {
            String v = string(header, k);
            if (v != null) {
                LocalDate d = normalizeSessionDate(v);
                if (d != null) return d;
            }
        }
        return null;
    }

    /** "2024-01-16T02:30:00" pertenece a la noche del 2024-01-15. */
    static LocalDate normalizeSessionDate(String value) {
        String v = value.trim();
        try {
            if (v.length() <= 10) return LocalDate.parse(v);
            if (v.endsWith("Z")) v = v.substring(0, v.length() - 1);
            return LocalDateTime.parse(v).minusHours(DATE_OFFSET_HOURS).toLocalDate();
        } catch (DateTimeParseException e) {
            logger.debug("Fecha no reconocida '{}'", value);
            return null;
        }
    }

    private static boolean isFits(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        return n.endsWith(".fits") || n.endsWith(".fit") || n.endsWith(".fts");
    }

    private static final class CachedFrame {
        final Frame frame;
        final long size;
        final long modified;

        CachedFrame(Frame frame, long size, long modified) {
            this.frame = frame;
            this.size = size;
            this.modified = modified;
        }
    }
}
