package tools.pixelcraft.domain.batch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import tools.pixelcraft.domain.image.FilterKind;
import tools.pixelcraft.domain.similarity.SimilarityScorer;

/**
 * Immutable description of a batch: what to filter, how, and where to write it. All validation
 * happens here, before any image is read.
 */
public class BatchRequest {
  private final List<Path> sources;
  private final FilterKind filter;
  private final int sensitivity;
  private final Path outputDirectory;
  private final OutputNamingPolicy namingPolicy;
  private final boolean compareWithSource;

  private BatchRequest(Builder builder) {
    if (builder.sources.isEmpty()) {
      throw new IllegalArgumentException("No images selected for processing");
    }

    this.sources = Collections.unmodifiableList(new ArrayList<>(builder.sources));
    this.filter = Objects.requireNonNull(builder.filter, "filter");
    this.sensitivity = SimilarityScorer.requireValidSensitivity(builder.sensitivity);
    this.outputDirectory = Objects.requireNonNull(builder.outputDirectory, "outputDirectory");
    this.namingPolicy = Objects.requireNonNull(builder.namingPolicy, "namingPolicy");
    this.compareWithSource = builder.compareWithSource;
  }

  /**
   * Creates a request with the default naming policy and no similarity readout.
   *
   * @param sources Source images, in processing order.
   * @param filterName Case-insensitive filter name.
   * @param sensitivity Similarity sensitivity, positive.
   * @param outputDirectory Directory receiving the filtered images.
   * @return The request.
   * @throws tools.pixelcraft.exceptions.UnknownFilterException if the filter name is unknown.
   */
  public static BatchRequest of(List<Path> sources, String filterName, int sensitivity,
      Path outputDirectory) {
    return builder().sources(sources).filter(FilterKind.fromName(filterName))
        .sensitivity(sensitivity).outputDirectory(outputDirectory).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return The sources in processing order, duplicates removed.
   */
  public List<Path> getSources() {
    return sources;
  }

  public FilterKind getFilter() {
    return filter;
  }

  public int getSensitivity() {
    return sensitivity;
  }

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public OutputNamingPolicy getNamingPolicy() {
    return namingPolicy;
  }

  public boolean isCompareWithSource() {
    return compareWithSource;
  }

  public static class Builder {
    private final LinkedHashSet<Path> sources = new LinkedHashSet<>();
    private FilterKind filter;
    private int sensitivity = 16;
    private Path outputDirectory;
    private OutputNamingPolicy namingPolicy = OutputNamingPolicy.suffixWithFilterName();
    private boolean compareWithSource;

    private Builder() {}

    /**
     * Adds sources. A path added twice keeps its first position.
     *
     * @param paths Source images.
     * @return This builder.
     */
    public Builder sources(Collection<Path> paths) {
      sources.addAll(paths);
      return this;
    }

    public Builder source(Path path) {
      sources.add(path);
      return this;
    }

    public Builder filter(FilterKind filter) {
      this.filter = filter;
      return this;
    }

    public Builder filter(String filterName) {
      this.filter = FilterKind.fromName(filterName);
      return this;
    }

    public Builder sensitivity(int sensitivity) {
      this.sensitivity = sensitivity;
      return this;
    }

    public Builder outputDirectory(Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public Builder namingPolicy(OutputNamingPolicy namingPolicy) {
      this.namingPolicy = namingPolicy;
      return this;
    }

    public Builder compareWithSource(boolean compareWithSource) {
      this.compareWithSource = compareWithSource;
      return this;
    }

    public BatchRequest build() {
      return new BatchRequest(this);
    }
  }
}
