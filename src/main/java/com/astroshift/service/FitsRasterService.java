package com.astroshift.service;

import com.astroshift.model.FitsImage;
import com.astroshift.model.Raster;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import nom.tam.util.Cursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.regex.Pattern;

public class FitsRasterService {

    // Claves astrométricas que se copian a la imagen de salida
    private static final Pattern WCS_KEY = Pattern.compile(
            "CTYPE[12]|CUNIT[12]|CRVAL[12]|CRPIX[12]|CDELT[12]|CD[12]_[12]|PC[12]_[12]|CROTA2" +
            "|EQUINOX|EPOCH|RADESYS|RADECSYS|LONPOLE|LATPOLE|(A|B|AP|BP)_(ORDER|\\d+_\\d+)");

    public FitsImage load(File f) throws FitsException, IOException {
        LOG.debug("load: reading {}", f);
        // Liberación explícita del archivo con try-with-resources
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new FitsException("no primary HDU in " + f);
            }
            Header header = hdu.getHeader();
            double[][] data = toDouble(hdu.getKernel(), header, f);
            return new FitsImage(new Raster(data), header);
        }
    }

    /**
     * Writes the raster as a BITPIX -64 primary image, copying the WCS keywords of
     * {@code wcsSource} (may be null). An existing file is only replaced once the new one
     * has been written completely.
     *
     * @throws FileAlreadyExistsException
     *   if the file exists and overwrite is false.
     */
    public void save(File f, Raster raster, Header wcsSource, boolean overwrite) throws FitsException, IOException {
        if (f.exists() && !overwrite) {
            throw new FileAlreadyExistsException(f.getAbsolutePath());
        }

        File dir = f.getAbsoluteFile().getParentFile();
        File tmp = new File(dir, "." + f.getName() + ".part");
        Files.deleteIfExists(tmp.toPath());
        try {
            writeFits(tmp, raster, wcsSource);
            Files.move(tmp.toPath(), f.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (FitsException | IOException | RuntimeException e) {
            // el archivo anterior queda intacto
            if (!tmp.delete() && tmp.exists()) {
                LOG.warn("save: failed to remove partial file {}", tmp);
            }
            throw e;
        }
        LOG.info("save: wrote {} ({}x{})", f, raster.width(), raster.height());
    }

    void writeFits(File f, Raster raster, Header wcsSource) throws FitsException, IOException {
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(raster.toArray());
            if (wcsSource != null) {
                int copied = copyWcsCards(wcsSource, hdu.getHeader());
                LOG.debug("writeFits: copied {} WCS cards", copied);
            }
            fits.addHDU(hdu);
            fits.write(f);
        }
    }

    int copyWcsCards(Header from, Header to) {
        int copied = 0;
        Cursor<String, HeaderCard> it = from.iterator();
        while (it.hasNext()) {
            HeaderCard card = it.next();
            String key = card.getKey();
            if (key != null && WCS_KEY.matcher(key).matches()) {
                to.addLine(card);
                copied++;
            }
        }
        return copied;
    }

    // BSCALE/BZERO; BLANK pasa a NaN en datos enteros. 8 bits sin signo
    double[][] toDouble(Object k, Header header, File f) {
        double bscale = header.getDoubleValue("BSCALE", 1.0);
        double bzero = header.getDoubleValue("BZERO", 0.0);
        boolean hasBlank = header.containsKey("BLANK");
        long blank = header.getLongValue("BLANK", 0);

        if (k instanceof byte[][]) {
            byte[][] s = (byte[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) {
                int raw = s[i][j] & 0xFF;
                d[i][j] = hasBlank && raw == blank ? Double.NaN : bzero + bscale * raw;
            }
            return d;
        }
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) {
                d[i][j] = hasBlank && s[i][j] == blank ? Double.NaN : bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) {
                d[i][j] = hasBlank && s[i][j] == blank ? Double.NaN : bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof long[][]) {
            long[][] s = (long[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) {
                d[i][j] = hasBlank && s[i][j] == blank ? Double.NaN : bzero + bscale * s[i][j];
            }
            return d;
        }
        if (k instanceof float[][]) {
            float[][] s = (float[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        if (k instanceof double[][]) {
            double[][] s = (double[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = bzero + bscale * s[i][j];
            return d;
        }
        throw new IllegalArgumentException("unsupported primary image in " + f + ": " +
                                           (k == null ? "no data" : k.getClass().getSimpleName()) +
                                           ", expected a 2-D image");
    }

    private static final Logger LOG = LoggerFactory.getLogger(FitsRasterService.class);
}
