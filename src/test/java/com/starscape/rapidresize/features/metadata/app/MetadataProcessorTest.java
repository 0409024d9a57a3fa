package com.starscape.rapidresize.features.metadata.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.starscape.rapidresize.common.exception.InvalidRequestException;
import com.starscape.rapidresize.features.metadata.domain.MetadataEdit;
import com.starscape.rapidresize.features.metadata.domain.MetadataOutcome;
import com.starscape.rapidresize.features.metadata.domain.MetadataPlan;
import com.starscape.rapidresize.features.metadata.domain.MetadataPolicy;
import com.starscape.rapidresize.features.metadata.domain.MetadataSettings;
import com.starscape.rapidresize.features.metadata.domain.SourceMetadata;
import com.starscape.rapidresize.features.metadata.infra.ExifEmbedder;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import com.starscape.rapidresize.integration.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetadataProcessorTest {

    private final SourceMetadataReader reader = new SourceMetadataReader();
    private final ExifEmbedder embedder = new ExifEmbedder();
    private final MetadataProcessor processor = new MetadataProcessor(embedder);

    private SourceMetadata withGps;
    private SourceMetadata plain;

    @BeforeEach
    void setUp() throws Exception {
        withGps = reader.read(TestUtils.createJpegWithExif(64, 48, true, "Original Artist"));
        plain = reader.read(TestUtils.createTestImage(64, 48));
    }

    @Test
    void shouldReadSourceSummary() {
        assertTrue(withGps.hasExif());
        assertTrue(withGps.hasGps());
        assertEquals(1, withGps.orientation());

        assertFalse(plain.hasExif());
        assertFalse(plain.hasGps());
    }

    @Test
    void shouldKeepExifIncludingGps() throws Exception {
        MetadataPlan plan = processor.plan(withGps, MetadataSettings.keep(), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.APPLIED, plan.outcome());
        assertFalse(plan.gpsRemoved());
        assertTrue(plan.payloadBytes() > 0);

        Metadata written = embedAndRead(plan);
        assertEquals("Original Artist",
                written.getFirstDirectoryOfType(ExifIFD0Directory.class).getString(ExifDirectoryBase.TAG_ARTIST));
        assertNotNull(written.getFirstDirectoryOfType(GpsDirectory.class));
    }

    @Test
    void shouldStripLocationButKeepOtherTags() throws Exception {
        MetadataPlan plan = processor.plan(withGps,
                new MetadataSettings(MetadataPolicy.KEEP, null, true), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.APPLIED, plan.outcome());
        assertTrue(plan.gpsRemoved());

        Metadata written = embedAndRead(plan);
        assertNull(written.getFirstDirectoryOfType(GpsDirectory.class));
        assertEquals("Original Artist",
                written.getFirstDirectoryOfType(ExifIFD0Directory.class).getString(ExifDirectoryBase.TAG_ARTIST));
    }

    @Test
    void shouldSkipEverythingOnRemove() {
        MetadataPlan plan = processor.plan(withGps,
                new MetadataSettings(MetadataPolicy.REMOVE, null, false), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.SKIPPED, plan.outcome());
        assertFalse(plan.hasPayload());
        assertTrue(plan.gpsRemoved());
    }

    @Test
    void shouldOverlayEditedFields() throws Exception {
        MetadataEdit edit = new MetadataEdit("New Artist", "(c) 2024 Studio", "", "2024:05:01 10:30:00");

        MetadataPlan plan = processor.plan(withGps,
                new MetadataSettings(MetadataPolicy.EDIT, edit, false), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.APPLIED, plan.outcome());
        assertEquals(List.of("Artist", "Copyright", "ImageDescription", "DateTimeOriginal"), plan.editedFields());

        Metadata written = embedAndRead(plan);
        ExifIFD0Directory ifd0 = written.getFirstDirectoryOfType(ExifIFD0Directory.class);
        assertEquals("New Artist", ifd0.getString(ExifDirectoryBase.TAG_ARTIST));
        assertEquals("(c) 2024 Studio", ifd0.getString(ExifDirectoryBase.TAG_COPYRIGHT));
        assertNull(ifd0.getString(ExifDirectoryBase.TAG_IMAGE_DESCRIPTION));
        assertEquals("2024:05:01 10:30:00", written.getFirstDirectoryOfType(ExifSubIFDDirectory.class)
                .getString(ExifDirectoryBase.TAG_DATETIME_ORIGINAL));
    }

    @Test
    void shouldCreateExifFromEditWhenSourceHasNone() {
        MetadataEdit edit = new MetadataEdit("Someone", null, null, null);

        MetadataPlan plan = processor.plan(plain,
                new MetadataSettings(MetadataPolicy.EDIT, edit, false), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.APPLIED, plan.outcome());
        assertEquals(List.of("Artist"), plan.editedFields());
    }

    @Test
    void shouldSkipWhenSourceHasNoExifToKeep() {
        assertEquals(MetadataOutcome.SKIPPED,
                processor.plan(plain, MetadataSettings.keep(), OutputFormat.JPEG).outcome());
    }

    @Test
    void shouldFallBackForFormatsWithoutExif() {
        MetadataPlan plan = processor.plan(withGps, MetadataSettings.keep(), OutputFormat.WEBP);

        assertEquals(MetadataOutcome.FALLBACK, plan.outcome());
        assertFalse(plan.hasPayload());
        assertNotNull(plan.fallbackReason());
    }

    @Test
    void shouldFallBackWhenBlockExceedsSegmentLimit() {
        MetadataEdit edit = new MetadataEdit(null, null, "x".repeat(MetadataProcessor.MAX_EXIF_BYTES + 100), null);

        MetadataPlan plan = processor.plan(withGps,
                new MetadataSettings(MetadataPolicy.EDIT, edit, false), OutputFormat.JPEG);

        assertEquals(MetadataOutcome.FALLBACK, plan.outcome());
        assertTrue(plan.fallbackReason().contains("exceeds"));
    }

    @Test
    void shouldPreviewWithoutTargetFormat() {
        MetadataPlan preview = processor.preview(withGps, new MetadataSettings(MetadataPolicy.KEEP, null, true));

        assertEquals(MetadataOutcome.APPLIED, preview.outcome());
        assertTrue(preview.gpsRemoved());
    }

    @Test
    void shouldRejectMalformedDateTime() {
        assertThrows(InvalidRequestException.class,
                () -> new MetadataEdit(null, null, null, "2024-05-01T10:30:00"));
    }

    private Metadata embedAndRead(MetadataPlan plan) throws Exception {
        byte[] jpeg = embedder.embed(TestUtils.createTestImage(32, 32), OutputFormat.JPEG, plan.outputSet());
        return ImageMetadataReader.readMetadata(new ByteArrayInputStream(jpeg));
    }
}
