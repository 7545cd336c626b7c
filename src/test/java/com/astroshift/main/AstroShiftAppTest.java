package com.astroshift.main;

import com.astroshift.service.FitsRasterService;
import com.astroshift.service.FitsRasterServiceTest;
import com.astroshift.service.WcsFixtures;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.File;

/**
 * Tests the {@link AstroShiftApp} class.
 */
public class AstroShiftAppTest {

    private File testDirectory;
    private File reference;
    private File image;

    @Before
    public void setup() throws Exception {
        testDirectory = FitsRasterServiceTest.createTestDirectory("test-app");
        reference = new File(testDirectory, "reference.fits");
        image = new File(testDirectory, "image.fits");

        final FitsRasterService fits = new FitsRasterService();
        fits.save(reference, WcsFixtures.ramp(5, 5), WcsFixtures.tanHeader(3, 3), true);
        fits.save(image, WcsFixtures.ramp(5, 5), WcsFixtures.tanHeader(4, 3), true);
    }

    @After
    public void tearDown() throws Exception {
        FitsRasterServiceTest.deleteRecursive(testDirectory);
    }

    @Test
    public void testRun() {
        final File output = new File(testDirectory, "shifted.fits");

        final int status = new AstroShiftApp().run(args(output, "--overwrite", "true", "--origin", "0"));

        Assert.assertEquals("invalid exit status", 0, status);
        Assert.assertTrue(output + " should exist", output.exists());
    }

    @Test
    public void testExistingOutputWithoutOverwrite() {
        final File output = new File(testDirectory, "shifted.fits");
        final AstroShiftApp app = new AstroShiftApp();

        Assert.assertEquals("first run should succeed", 0, app.run(args(output, "--overwrite", "false")));
        Assert.assertEquals("second run should fail", 1, app.run(args(output, "--overwrite", "false")));
    }

    @Test
    public void testBadArguments() {
        final AstroShiftApp app = new AstroShiftApp();
        final File output = new File(testDirectory, "never.fits");

        Assert.assertEquals("missing options", 1, app.run(new String[] {"--reference", reference.getPath()}));
        Assert.assertEquals("help", 1, app.run(new String[] {"--help"}));
        Assert.assertEquals("bad origin", 1, app.run(args(output, "--origin", "2")));
        Assert.assertFalse(output + " should not exist", output.exists());
    }

    @Test
    public void testMissingInputFile() {
        final File output = new File(testDirectory, "never.fits");
        final int status = new AstroShiftApp().run(new String[] {
                "--reference", new File(testDirectory, "nope.fits").getPath(),
                "--image", image.getPath(),
                "--out", output.getPath()
        });
        Assert.assertEquals("invalid exit status", 1, status);
    }

    private String[] args(final File output, final String... extra) {
        final String[] base = {"--reference", reference.getPath(), "--image", image.getPath(), "--out", output.getPath()};
        final String[] all = new String[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }
}
