package com.gentoro.reformat.codec;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import com.drew.metadata.MetadataException;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.gentoro.reformat.exception.CodecException;
import com.gentoro.reformat.geometry.PixelRect;
import com.gentoro.reformat.logging.LoggingService;
import com.gentoro.reformat.model.ImageFormat;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorConvertOp;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;

/**
 * {@link ImageCodec} on top of {@code javax.imageio} and Java2D.
 *
 * <p>Readers are discovered through the ImageIO service registry, so the TwelveMonkeys WebP
 * plugin on the classpath adds WebP decoding. EXIF orientation is read with metadata-extractor.
 * Quarter turns, flips and extraction copy pixels exactly; only resizing interpolates.
 */
public class Java2dImageCodec implements ImageCodec {
  private static final Logger log = LoggingService.getLogger(Java2dImageCodec.class);

  static {
    ImageIO.setUseCache(false);
    ImageIO.scanForPlugins();
  }

  @Override
  public ImageInfo probe(ImageSource source) {
    byte[] bytes = read(source);
    try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      ImageReader reader = selectReader(iis, source);
      try {
        reader.setInput(iis, true, true);
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);
        boolean alpha = hasAlpha(reader);
        ImageFormat format = ImageFormat.fromName(reader.getFormatName());
        return new ImageInfo(width, height, format, alpha, readOrientation(bytes, source));
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      throw new CodecException("Failed to read image header of " + source, e);
    }
  }

  @Override
  public DecodedImage decode(ImageSource source) {
    byte[] bytes = read(source);
    try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      ImageReader reader = selectReader(iis, source);
      try {
        reader.setInput(iis, true, true);
        BufferedImage image = reader.read(0, reader.getDefaultReadParam());
        ImageFormat format = ImageFormat.fromName(reader.getFormatName());
        return new DecodedImage(image, format, readOrientation(bytes, source));
      } finally {
        reader.dispose();
      }
    } catch (IOException | RuntimeException e) {
      if (e instanceof CodecException ce) throw ce;
      throw new CodecException("Failed to decode " + source + ": " + e.getMessage(), e);
    }
  }

  @Override
  public BufferedImage rotateQuarterTurns(BufferedImage image, int steps) {
    int turns = Math.floorMod(steps, 4);
    if (turns == 0) return copy(image);
    int w = image.getWidth();
    int h = image.getHeight();
    int[] src = image.getRGB(0, 0, w, h, null, 0, w);
    boolean swap = turns % 2 == 1;
    int dw = swap ? h : w;
    int dh = swap ? w : h;
    int[] dst = new int[src.length];
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        int dx;
        int dy;
        switch (turns) {
          case 1 -> {
            dx = h - 1 - y;
            dy = x;
          }
          case 2 -> {
            dx = w - 1 - x;
            dy = h - 1 - y;
          }
          default -> {
            dx = y;
            dy = w - 1 - x;
          }
        }
        dst[dy * dw + dx] = src[y * w + x];
      }
    }
    return fromPixels(dst, dw, dh, image.getColorModel().hasAlpha());
  }

  @Override
  public BufferedImage flipHorizontal(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    int[] src = image.getRGB(0, 0, w, h, null, 0, w);
    int[] dst = new int[src.length];
    for (int y = 0; y < h; y++) {
      int row = y * w;
      for (int x = 0; x < w; x++) {
        dst[row + (w - 1 - x)] = src[row + x];
      }
    }
    return fromPixels(dst, w, h, image.getColorModel().hasAlpha());
  }

  @Override
  public BufferedImage flipVertical(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    int[] src = image.getRGB(0, 0, w, h, null, 0, w);
    int[] dst = new int[src.length];
    for (int y = 0; y < h; y++) {
      System.arraycopy(src, y * w, dst, (h - 1 - y) * w, w);
    }
    return fromPixels(dst, w, h, image.getColorModel().hasAlpha());
  }

  @Override
  public BufferedImage extract(BufferedImage image, PixelRect region) {
    if (region.left() < 0
        || region.top() < 0
        || region.width() < 1
        || region.height() < 1
        || region.right() > image.getWidth()
        || region.bottom() > image.getHeight()) {
      throw new CodecException(
          "Extract region "
              + region
              + " outside image bounds "
              + image.getWidth()
              + "x"
              + image.getHeight());
    }
    int[] px =
        image.getRGB(
            region.left(), region.top(), region.width(), region.height(), null, 0, region.width());
    return fromPixels(px, region.width(), region.height(), image.getColorModel().hasAlpha());
  }

  @Override
  public BufferedImage resize(BufferedImage image, int width, int height) {
    if (width < 1 || height < 1) {
      throw new CodecException("Invalid resize dimensions " + width + "x" + height);
    }
    BufferedImage resized = new BufferedImage(width, height, bestTypeFor(image));
    Graphics2D g2 = resized.createGraphics();
    try {
      g2.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g2.drawImage(image, 0, 0, width, height, null);
    } finally {
      g2.dispose();
    }
    return resized;
  }

  @Override
  public BufferedImage toSrgb(BufferedImage image) {
    ColorSpace cs = image.getColorModel().getColorSpace();
    int type = image.getType();
    if (cs.isCS_sRGB()
        && (type == BufferedImage.TYPE_INT_RGB
            || type == BufferedImage.TYPE_INT_ARGB
            || type == BufferedImage.TYPE_3BYTE_BGR
            || type == BufferedImage.TYPE_4BYTE_ABGR)) {
      return image;
    }
    BufferedImage converted =
        new BufferedImage(image.getWidth(), image.getHeight(), bestTypeFor(image));
    new ColorConvertOp(null).filter(image, converted);
    return converted;
  }

  @Override
  public byte[] encode(BufferedImage image, ImageFormat format, int quality) {
    ImageWriter writer = writerFor(format);
    if (writer == null) {
      throw new CodecException("No encoder available for " + format);
    }
    BufferedImage output = format.supportsAlpha() ? image : flatten(image);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(bytes)) {
      writer.setOutput(ios);
      ImageWriteParam param = writer.getDefaultWriteParam();
      configure(param, format, quality);
      writer.write(null, new IIOImage(output, null, null), param);
      ios.flush();
    } catch (IOException e) {
      throw new CodecException("Failed to encode " + format + ": " + e.getMessage(), e);
    } finally {
      writer.dispose();
    }
    return bytes.toByteArray();
  }

  @Override
  public boolean canEncode(ImageFormat format) {
    ImageWriter writer = writerFor(format);
    if (writer == null) return false;
    writer.dispose();
    return true;
  }

  private static void configure(ImageWriteParam param, ImageFormat format, int quality) {
    if (!param.canWriteCompressed()) return;
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    String[] types = param.getCompressionTypes();
    if (format == ImageFormat.TIFF) {
      param.setCompressionType("LZW");
      return;
    }
    if (param.getCompressionType() == null && types != null && types.length > 0) {
      param.setCompressionType(types[0]);
    }
    if (format.supportsQuality()) {
      param.setCompressionQuality(Math.max(0f, Math.min(1f, quality / 100f)));
    } else if (format == ImageFormat.PNG) {
      // quality 0 selects deflate level 9
      param.setCompressionQuality(0f);
    } else {
      param.setCompressionMode(ImageWriteParam.MODE_DEFAULT);
    }
  }

  private static ImageWriter writerFor(ImageFormat format) {
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(writerName(format));
    return writers.hasNext() ? writers.next() : null;
  }

  private static String writerName(ImageFormat format) {
    return format == ImageFormat.JPEG ? "jpeg" : format.name().toLowerCase(Locale.ROOT);
  }

  private static ImageReader selectReader(ImageInputStream iis, ImageSource source) {
    if (iis == null) {
      throw new CodecException("Cannot open image stream for " + source);
    }
    Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
    if (!readers.hasNext()) {
      throw new CodecException("Unsupported or corrupt image: " + source);
    }
    return readers.next();
  }

  private static boolean hasAlpha(ImageReader reader) throws IOException {
    ImageTypeSpecifier raw = reader.getRawImageType(0);
    if (raw != null) {
      return raw.getColorModel().hasAlpha();
    }
    Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
    return types.hasNext() && types.next().getColorModel().hasAlpha();
  }

  /** EXIF orientation, {@link Orientation#NORMAL} when missing or unreadable. */
  private static int readOrientation(byte[] bytes, ImageSource source) {
    try {
      Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes));
      ExifIFD0Directory exif = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
      if (exif != null && exif.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) {
        int value = exif.getInt(ExifIFD0Directory.TAG_ORIENTATION);
        return Orientation.isValid(value) ? value : Orientation.NORMAL;
      }
    } catch (ImageProcessingException | MetadataException | IOException e) {
      log.debug("No usable orientation metadata in {}: {}", source, e.getMessage());
    }
    return Orientation.NORMAL;
  }

  private static byte[] read(ImageSource source) {
    try {
      return source.readAllBytes();
    } catch (IOException e) {
      throw new CodecException("Cannot read " + source + ": " + e.getMessage(), e);
    }
  }

  /** Draw onto white for encoders that cannot store alpha. */
  private static BufferedImage flatten(BufferedImage image) {
    if (!image.getColorModel().hasAlpha() && image.getType() == BufferedImage.TYPE_3BYTE_BGR) {
      return image;
    }
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
    Graphics2D g = rgb.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return rgb;
  }

  private static BufferedImage copy(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    return fromPixels(image.getRGB(0, 0, w, h, null, 0, w), w, h, image.getColorModel().hasAlpha());
  }

  private static BufferedImage fromPixels(int[] argb, int width, int height, boolean alpha) {
    BufferedImage out =
        new BufferedImage(
            width, height, alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
    out.setRGB(0, 0, width, height, argb, 0, width);
    return out;
  }

  private static int bestTypeFor(BufferedImage image) {
    return image.getColorModel().hasAlpha()
        ? BufferedImage.TYPE_4BYTE_ABGR
        : BufferedImage.TYPE_3BYTE_BGR;
  }
}
