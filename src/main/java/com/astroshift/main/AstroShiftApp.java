package com.astroshift.main;

import com.astroshift.model.ReprojectionResult;
import com.astroshift.service.ReprojectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shifts a FITS image onto the pixel grid of a reference FITS image.
 * <pre>
 * Usage: java -jar astroshift.jar [options]
 *   * --reference      FITS image whose pixel grid and WCS define the output
 *   * --image          FITS image to shift onto the reference grid
 *   * --out            Path of the shifted FITS image
 *     --overwrite      true|false, replace the output file if it exists
 *     --origin         0|1, pixel origin passed to the WCS transforms
 *     --missing-policy ZERO_AS_MISSING|MASK_ONLY
 *     --missing-value  sentinel for pixels without data, e.g. NaN
 * </pre>
 */
public class AstroShiftApp {

    private final ReprojectionService reprojectionService;

    public AstroShiftApp() {
        this(new ReprojectionService());
    }

    public AstroShiftApp(ReprojectionService reprojectionService) {
        this.reprojectionService = reprojectionService;
    }

    public int run(String[] args) {
        LOG.info("run: entry");
        long start = System.currentTimeMillis();

        ReprojectParameters parameters = new ReprojectParameters();
        if (!parameters.parse(args)) {
            return 1;
        }

        try {
            ReprojectionResult result = reprojectionService.reproject(parameters.getReferenceFile(),
                                                                      parameters.getImageFile(),
                                                                      parameters.getOutputFile(),
                                                                      parameters.toOptions());
            LOG.info("run: exit, wrote {} ({}), processing completed in {} ms",
                     result.outputFile, result.statistics, System.currentTimeMillis() - start);
            return 0;
        } catch (Exception e) {
            LOG.error("run: caught exception", e);
            LOG.info("run: exit, processing failed after {} ms", System.currentTimeMillis() - start);
            return 1;
        }
    }

    public static void main(String[] args) {
        System.exit(new AstroShiftApp().run(args));
    }

    private static final Logger LOG = LoggerFactory.getLogger(AstroShiftApp.class);
}
