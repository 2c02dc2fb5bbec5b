package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.assembly.SlidePlan;
import com.example.demo.deckgen.catalog.PlaceholderRole;
import com.example.demo.deckgen.exception.DocumentAssemblyException;
import com.example.demo.deckgen.image.ResolvedImage;
import com.example.demo.deckgen.model.ImageSlide;
import com.example.demo.deckgen.model.SlideSpec;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.PictureData.PictureType;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;

/**
 * Places the resolved image of an image slide, center-cropped to the
 * picture box so the aspect ratio is preserved.
 */
@Slf4j
@Component
@Order(10)
public class ImageBinder implements ContentBinder {

    @Override
    public boolean supports(SlideSpec slide) {
        return slide instanceof ImageSlide;
    }

    @Override
    public void bind(SlideCanvas canvas, SlidePlan plan) {
        ImageSlide slide = (ImageSlide) plan.getSlide();
        ResolvedImage image = plan.getImage();
        if (image == null) {
            throw new DocumentAssemblyException("No image resolved for slide " + plan.getIndex(), null);
        }
        Rectangle2D region = SlideRegions.picture(canvas, slide);
        canvas.takeRegion(PlaceholderRole.PICTURE);

        byte[] png = CenterCrop.toAspect(image.getBytes(), region.getWidth(), region.getHeight());
        XSLFPictureData data = canvas.getSlide().getSlideShow().addPicture(png, PictureType.PNG);
        XSLFPictureShape picture = canvas.getSlide().createPicture(data);
        picture.setAnchor(region);
        log.debug("Image for slide {} placed from {} (fallback={})", plan.getIndex(), image.getSource(), image.isFallbackUsed());
    }
}
