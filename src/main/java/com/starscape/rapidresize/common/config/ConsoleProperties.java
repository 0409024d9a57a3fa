package com.starscape.rapidresize.common.config;

import com.starscape.rapidresize.features.metadata.domain.MetadataPolicy;
import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Inputs for the console consumer.
 * Binds to app.console.* properties; the runner only starts when enabled.
 */
@ConfigurationProperties(prefix = "app.console")
public class ConsoleProperties {

    private boolean enabled = false;
    private List<String> sources = new ArrayList<>();
    private boolean recursive = false;
    private String outputDir;
    private OutputFormat format = OutputFormat.JPEG;
    private int maxDimension = 1280;
    private int quality = 85;
    private int balance = 5;
    private MetadataPolicy metadata = MetadataPolicy.KEEP;
    private boolean removeGps = false;
    private String editArtist;
    private String editCopyright;
    private String editDescription;
    private String editDateTimeOriginal;
    private boolean dryRun = false;
    private boolean retryFailed = true;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public List<String> getSources() { return sources; }
    public void setSources(List<String> sources) { this.sources = sources; }

    public boolean isRecursive() { return recursive; }
    public void setRecursive(boolean recursive) { this.recursive = recursive; }

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public OutputFormat getFormat() { return format; }
    public void setFormat(OutputFormat format) { this.format = format; }

    public int getMaxDimension() { return maxDimension; }
    public void setMaxDimension(int maxDimension) { this.maxDimension = maxDimension; }

    public int getQuality() { return quality; }
    public void setQuality(int quality) { this.quality = quality; }

    public int getBalance() { return balance; }
    public void setBalance(int balance) { this.balance = balance; }

    public MetadataPolicy getMetadata() { return metadata; }
    public void setMetadata(MetadataPolicy metadata) { this.metadata = metadata; }

    public boolean isRemoveGps() { return removeGps; }
    public void setRemoveGps(boolean removeGps) { this.removeGps = removeGps; }

    public String getEditArtist() { return editArtist; }
    public void setEditArtist(String editArtist) { this.editArtist = editArtist; }

    public String getEditCopyright() { return editCopyright; }
    public void setEditCopyright(String editCopyright) { this.editCopyright = editCopyright; }

    public String getEditDescription() { return editDescription; }
    public void setEditDescription(String editDescription) { this.editDescription = editDescription; }

    public String getEditDateTimeOriginal() { return editDateTimeOriginal; }
    public void setEditDateTimeOriginal(String editDateTimeOriginal) { this.editDateTimeOriginal = editDateTimeOriginal; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean isRetryFailed() { return retryFailed; }
    public void setRetryFailed(boolean retryFailed) { this.retryFailed = retryFailed; }
}
