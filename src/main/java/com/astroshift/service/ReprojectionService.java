package com.astroshift.service;

import com.astroshift.model.CelestialPoint;
import com.astroshift.model.FitsImage;
import com.astroshift.model.MappedCoordinateField;
import com.astroshift.model.Raster;
import com.astroshift.model.RasterShape;
import com.astroshift.model.RasterStatistics;
import com.astroshift.model.ReprojectionOptions;
import com.astroshift.model.ReprojectionResult;
import com.astroshift.model.ValidityMask;
import nom.tam.fits.FitsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

public class ReprojectionService {

    private final FitsRasterService fitsService;
    private final WcsHeaderParser wcsParser;
    private final CoordinateMapper mapper;
    private final RasterStatisticsService statisticsService;

    public ReprojectionService() {
        this(new FitsRasterService(), new WcsHeaderParser(), new CoordinateMapper(), new RasterStatisticsService());
    }

    public ReprojectionService(FitsRasterService fitsService,
                               WcsHeaderParser wcsParser,
                               CoordinateMapper mapper,
                               RasterStatisticsService statisticsService) {
        this.fitsService = fitsService;
        this.wcsParser = wcsParser;
        this.mapper = mapper;
        this.statisticsService = statisticsService;
    }

    public ReprojectionResult reproject(File reference, File image, File output, ReprojectionOptions options)
            throws FitsException, IOException {

        LOG.info("reproject: entry, reference={}, image={}, output={}, options=[{}]",
                 reference, image, output, options);

        long start = System.currentTimeMillis();

        FitsImage ref = fitsService.load(reference);
        FitsImage img = fitsService.load(image);

        ReprojectionResult inMemory = reproject(ref, img, options);

        if (output != null) {
            fitsService.save(output, inMemory.raster, ref.header, options.overwrite);
        }

        LOG.info("reproject: exit, {} in {} ms", inMemory.statistics, System.currentTimeMillis() - start);

        return new ReprojectionResult(inMemory.raster, inMemory.mask, inMemory.statistics, output);
    }

    public ReprojectionResult reproject(FitsImage reference, FitsImage image, ReprojectionOptions options) {
        AstrometricTransform refWcs = wcsParser.parse(reference.header);
        AstrometricTransform imgWcs = wcsParser.parse(image.header);

        RasterShape shape = reference.raster.shape();
        CelestialPoint center = refWcs.pixelToSky((shape.width - 1) / 2.0 + options.origin.offset,
                                                  (shape.height - 1) / 2.0 + options.origin.offset,
                                                  options.origin);
        LOG.info("reproject: reference shape {}, image shape {}, footprint center {}",
                 shape, image.raster.shape(), center);

        MappedCoordinateField mapped = mapper.map(shape, refWcs, imgWcs, options.origin);

        Resampler resampler = new Resampler(options.missingPolicy, options.missingValue);
        ValidityMask mask = resampler.validityMask(shape, image.raster, mapped);
        Raster shifted = resampler.resample(shape, image.raster, mapped, mask);

        if (mask.validCount() == 0) {
            LOG.warn("reproject: images do not overlap, every output pixel is missing");
        }

        RasterStatistics stats = statisticsService.analyze(shifted, options.missingValue);
        return new ReprojectionResult(shifted, mask, stats, null);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ReprojectionService.class);
}
