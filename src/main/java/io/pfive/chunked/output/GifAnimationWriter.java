// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.output;

import io.pfive.chunked.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/// Assembles PNG frames into a looping animated GIF using the GIF writer bundled with the JDK.
/// Transparent nodata pixels of the frames are drawn in a fill color, so they stay distinct from
/// dark data values.
public abstract class GifAnimationWriter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String GIF_METADATA_FORMAT = "javax_imageio_gif_image_1.0";

    public static int write (List<Path> framePaths, Path output, double frameDurationSec) {
        return write(framePaths, output, frameDurationSec, Configuration.FRAME_FILL_RGB);
    }

    /// Frames are written in the order given. Frames whose files do not exist are skipped.
    /// @param fillRgb the color behind transparent pixels, as 0xRRGGBB.
    /// @return the number of frames written.
    public static int write (List<Path> framePaths, Path output, double frameDurationSec, int fillRgb) {
        checkArgument(frameDurationSec > 0, "Frame duration must be positive.");
        ImageWriter writer = ImageIO.getImageWritersByFormatName("gif").next();
        int nFrames = 0;
        try (ImageOutputStream out = ImageIO.createImageOutputStream(output.toFile())) {
            writer.setOutput(out);
            writer.prepareWriteSequence(null);
            ImageWriteParam param = writer.getDefaultWriteParam();
            for (Path framePath : framePaths) {
                if (!Files.exists(framePath)) {
                    LOG.warn("Animation frame {} is missing, skipping it.", framePath);
                    continue;
                }
                BufferedImage frame = toRgb(ImageIO.read(framePath.toFile()), fillRgb);
                IIOMetadata metadata = frameMetadata(writer, param, frame, frameDurationSec);
                writer.writeToSequence(new IIOImage(frame, null, metadata), param);
                nFrames += 1;
            }
            writer.endWriteSequence();
        } catch (IOException e) {
            throw new RuntimeException(e);
        } finally {
            writer.dispose();
        }
        return nFrames;
    }

    /// The GIF encoder builds its palette from opaque RGB images most reliably.
    private static BufferedImage toRgb (BufferedImage image, int fillRgb) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) return image;
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = rgb.createGraphics();
        try {
            graphics.setColor(new Color(fillRgb));
            graphics.fillRect(0, 0, image.getWidth(), image.getHeight());
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return rgb;
    }

    private static IIOMetadata frameMetadata (ImageWriter writer, ImageWriteParam param,
                                              BufferedImage frame, double frameDurationSec)
          throws IOException {
        IIOMetadata metadata = writer.getDefaultImageMetadata(
              ImageTypeSpecifier.createFromRenderedImage(frame), param);
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(GIF_METADATA_FORMAT);

        IIOMetadataNode control = child(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "none");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        // GIF delays are in hundredths of a second.
        control.setAttribute("delayTime", Integer.toString((int) Math.round(frameDurationSec * 100)));
        control.setAttribute("transparentColorIndex", "0");

        IIOMetadataNode applications = child(root, "ApplicationExtensions");
        IIOMetadataNode loop = new IIOMetadataNode("ApplicationExtension");
        loop.setAttribute("applicationID", "NETSCAPE");
        loop.setAttribute("authenticationCode", "2.0");
        loop.setUserObject(new byte[] {0x1, 0, 0}); // Loop forever
        applications.appendChild(loop);

        metadata.setFromTree(GIF_METADATA_FORMAT, root);
        return metadata;
    }

    private static IIOMetadataNode child (IIOMetadataNode root, String name) {
        for (int i = 0; i < root.getLength(); i++) {
            if (root.item(i).getNodeName().equalsIgnoreCase(name)) return (IIOMetadataNode) root.item(i);
        }
        IIOMetadataNode node = new IIOMetadataNode(name);
        root.appendChild(node);
        return node;
    }

}
