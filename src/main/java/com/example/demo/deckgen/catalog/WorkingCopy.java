package com.example.demo.deckgen.catalog;

import com.example.demo.deckgen.exception.DocumentAssemblyException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A private, mutable copy of the template document for one render. Never
 * shared between renders; close it when the package has been written.
 */
@Slf4j
public class WorkingCopy implements Closeable {
    private final XMLSlideShow slideShow;
    private final Map<String, XSLFSlideLayout> layouts = new HashMap<>();

    WorkingCopy(XMLSlideShow slideShow) {
        this.slideShow = slideShow;
        // sample slides shipped with the template are not part of the output
        while (!slideShow.getSlides().isEmpty()) {
            slideShow.removeSlide(0);
        }
    }

    public XMLSlideShow getSlideShow() {
        return slideShow;
    }

    /**
     * Append a slide built from the given layout.
     */
    public XSLFSlide appendSlide(LayoutHandle handle) {
        return slideShow.createSlide(layoutFor(handle));
    }

    XSLFSlideLayout layoutFor(LayoutHandle handle) {
        String key = handle.getMasterIndex() + "/" + handle.getLayoutName();
        return layouts.computeIfAbsent(key, k -> {
            List<XSLFSlideMaster> masters = slideShow.getSlideMasters();
            if (handle.getMasterIndex() >= masters.size()) {
                throw new DocumentAssemblyException("Template master " + handle.getMasterIndex() + " missing in working copy", null);
            }
            for (XSLFSlideLayout layout : masters.get(handle.getMasterIndex()).getSlideLayouts()) {
                if (handle.getLayoutName().equals(layout.getName())) {
                    return layout;
                }
            }
            throw new DocumentAssemblyException("Layout '" + handle.getLayoutName() + "' missing in working copy", null);
        });
    }

    public byte[] toBytes() {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            slideShow.write(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to serialize presentation package", e);
        }
    }

    @Override
    public void close() {
        try {
            slideShow.close();
        } catch (IOException e) {
            log.warn("Error closing working copy", e);
        }
    }
}
