package com.astroshift.main;

import com.astroshift.model.MissingValuePolicy;
import com.astroshift.model.PixelOrigin;
import com.astroshift.model.ReprojectionOptions;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

import java.io.File;

// Opciones no indicadas toman los valores de AppConfig
@Parameters
public class ReprojectParameters {

    @Parameter(names = "--help", description = "Display this note", help = true)
    public boolean help;

    @Parameter(names = "--reference", description = "FITS image whose pixel grid and WCS define the output", required = true)
    public String reference;

    @Parameter(names = "--image", description = "FITS image to shift onto the reference grid", required = true)
    public String image;

    @Parameter(names = "--out", description = "Path of the shifted FITS image", required = true)
    public String out;

    @Parameter(names = "--overwrite", description = "Replace the output file if it exists", arity = 1)
    public Boolean overwrite;

    @Parameter(names = "--origin", description = "Pixel origin passed to the WCS transforms (0 or 1)")
    public Integer origin;

    @Parameter(names = "--missing-policy", description = "ZERO_AS_MISSING marks every zero as missing, MASK_ONLY only unmapped pixels")
    public MissingValuePolicy missingPolicy;

    @Parameter(names = "--missing-value", description = "Sentinel written where there is no data (e.g. NaN)")
    public Double missingValue;

    private transient JCommander jCommander;

    // false si se mostró el uso (--help o error)
    public boolean parse(String[] args) {
        jCommander = new JCommander(this);
        jCommander.setProgramName("java -jar astroshift.jar");

        boolean parseFailed = true;
        try {
            jCommander.parse(args);
            parseFailed = false;
        } catch (ParameterException pe) {
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage());
        }

        if (help || parseFailed) {
            jCommander.getConsole().println("");
            jCommander.usage();
            return false;
        }
        return true;
    }

    public ReprojectionOptions toOptions() {
        ReprojectionOptions o = ReprojectionOptions.fromConfig();
        if (origin != null) o.origin = PixelOrigin.of(origin);
        if (missingPolicy != null) o.missingPolicy = missingPolicy;
        if (missingValue != null) o.missingValue = missingValue;
        if (overwrite != null) o.overwrite = overwrite;
        return o;
    }

    public File getReferenceFile() { return new File(reference); }

    public File getImageFile() { return new File(image); }

    public File getOutputFile() { return new File(out); }

    @Override
    public String toString() {
        return "reference=" + reference + ", image=" + image + ", out=" + out + ", overwrite=" + overwrite +
               ", origin=" + origin + ", missingPolicy=" + missingPolicy + ", missingValue=" + missingValue;
    }
}
