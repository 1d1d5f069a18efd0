package com.tessera.core.json;

import com.tessera.core.image.ImageCodec;
import com.tessera.core.model.CellImageFitMode;
import com.tessera.core.model.CellPhoto;
import com.tessera.core.model.CellShape;
import com.tessera.core.model.MosaicProject;
import com.tessera.core.model.PhotoOrientation;
import com.tessera.core.model.PrimaryImageSizingMode;
import com.tessera.core.model.PrintSize;
import com.tessera.logging.AppLogger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.awt.Dimension;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads a mosaic project description from JSON. Relative paths resolve against the directory
 * holding the project file.
 */
public final class MosaicProjectLoader {

    private static final Logger LOGGER = AppLogger.get();
    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "gif");

    private final ImageCodec codec;

    public MosaicProjectLoader(ImageCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * A parsed project plus the optional max-uses override it carries.
     */
    public record ProjectFile(MosaicProject project, OptionalInt maxUses) {
    }

    public ProjectFile load(Path projectFile) throws IOException {
        if (projectFile == null) {
            throw new IllegalArgumentException("Project file is required");
        }
        String content = Files.readString(projectFile);
        JSONObject root;
        try {
            root = new JSONObject(content);
        } catch (JSONException ex) {
            throw new IOException("Malformed project file " + projectFile + ": " + ex.getMessage(), ex);
        }
        Path baseDir = projectFile.toAbsolutePath().getParent();
        try {
            return parse(root, baseDir);
        } catch (JSONException ex) {
            throw new IOException("Invalid project file " + projectFile + ": " + ex.getMessage(), ex);
        }
    }

    ProjectFile parse(JSONObject root, Path baseDir) throws IOException {
        MosaicProject.Builder builder = MosaicProject.builder();

        String primary = root.optString("primaryImage", "");
        if (!primary.isBlank()) {
            builder.primaryImage(resolve(baseDir, primary));
        }

        List<CellPhoto> photos = new ArrayList<>();
        JSONArray cellPhotos = root.optJSONArray("cellPhotos");
        if (cellPhotos != null) {
            for (int i = 0; i < cellPhotos.length(); i++) {
                Object entry = cellPhotos.get(i);
                if (entry instanceof JSONObject object) {
                    Path path = resolve(baseDir, object.getString("path"));
                    String orientation = object.optString("orientation", "");
                    if (orientation.isBlank()) {
                        addProbed(photos, path);
                    } else {
                        photos.add(new CellPhoto(path, parseEnum(PhotoOrientation.class, orientation)));
                    }
                } else {
                    addProbed(photos, resolve(baseDir, String.valueOf(entry)));
                }
            }
        }
        String photoDir = root.optString("cellPhotoDir", "");
        if (!photoDir.isBlank()) {
            for (Path path : listImages(resolve(baseDir, photoDir))) {
                addProbed(photos, path);
            }
        }
        builder.cellPhotos(photos);

        JSONObject printSize = root.optJSONObject("printSize");
        if (printSize != null) {
            builder.printSize(new PrintSize(
                printSize.optString("name", null),
                printSize.getDouble("width"),
                printSize.getDouble("height")));
        }
        if (root.has("resolutionPpi")) {
            builder.resolutionPpi(root.getInt("resolutionPpi"));
        }
        if (root.has("cellSizeMm")) {
            builder.cellSizeMm(root.getDouble("cellSizeMm"));
        }
        if (root.has("cellShape")) {
            builder.cellShape(CellShape.from(root.getString("cellShape")));
        }
        if (root.has("cellFitMode")) {
            builder.cellFitMode(parseEnum(CellImageFitMode.class, root.getString("cellFitMode")));
        }
        if (root.has("primarySizing")) {
            builder.primarySizing(parseEnum(PrimaryImageSizingMode.class, root.getString("primarySizing")));
        }

        builder.pattern(root.optString("pattern", "Square"))
            .colorChangePercent(root.optInt("colorChangePercent", 0))
            .duplicateSpacing(root.optInt("duplicateSpacing", 0))
            .randomCellCandidates(root.optInt("randomCellCandidates", MosaicProject.DEFAULT_RANDOM_CELL_CANDIDATES))
            .useAllImages(root.optBoolean("useAllImages", false))
            .createReport(root.optBoolean("createReport", true))
            .exportPdf(root.optBoolean("exportPdf", false));

        OptionalInt maxUses = root.has("maxUses") ? OptionalInt.of(root.getInt("maxUses")) : OptionalInt.empty();
        return new ProjectFile(builder.build(), maxUses);
    }

    /**
     * Matches enum constants ignoring case, underscores, dashes and spaces, so
     * {@code "CropToFill"}, {@code "crop-to-fill"} and {@code "CROP_TO_FILL"} are equivalent.
     */
    static <E extends Enum<E>> E parseEnum(Class<E> type, String raw) {
        String wanted = normalize(raw);
        for (E constant : type.getEnumConstants()) {
            if (normalize(constant.name()).equals(wanted)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown " + type.getSimpleName() + ": " + raw);
    }

    private static String normalize(String value) {
        StringBuilder sb = new StringBuilder();
        for (char c : value.trim().toCharArray()) {
            if (Character.isLetterOrDigit(c)) {
                sb.append(Character.toUpperCase(c));
            }
        }
        return sb.toString();
    }

    private void addProbed(List<CellPhoto> photos, Path path) {
        try {
            Dimension size = codec.readDimensions(path);
            photos.add(new CellPhoto(path, PhotoOrientation.of(size.width, size.height)));
        } catch (IOException ex) {
            LOGGER.warning("Skipping unreadable cell photo " + path + ": " + ex.getMessage());
        }
    }

    private static List<Path> listImages(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Cell photo directory not found: " + directory);
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(Files::isRegularFile)
                .filter(MosaicProjectLoader::isImage)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static boolean isImage(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static Path resolve(Path baseDir, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDir == null) {
            return path.normalize();
        }
        return baseDir.resolve(path).normalize();
    }
}
