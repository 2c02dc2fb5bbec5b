package com.example.demo.deckgen.assembly;

import com.example.demo.deckgen.aspect.LogExecutionTime;
import com.example.demo.deckgen.binder.ContentBinder;
import com.example.demo.deckgen.binder.SlideCanvas;
import com.example.demo.deckgen.catalog.WorkingCopy;
import com.example.demo.deckgen.exception.DeckGenerationException;
import com.example.demo.deckgen.exception.DocumentAssemblyException;
import com.example.demo.deckgen.model.SlideDeckSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLProperties;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.springframework.stereotype.Component;

import java.awt.Dimension;
import java.util.List;

/**
 * Composes the planned slides, in order, into a working copy of the template
 * and serializes it. Either the whole package is produced or nothing is.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentAssembler {
    private final List<ContentBinder> binders;

    @LogExecutionTime("Assembling Presentation")
    public byte[] assemble(WorkingCopy workingCopy, SlideDeckSpec deck, List<SlidePlan> plans) {
        XMLSlideShow slideShow = workingCopy.getSlideShow();
        Dimension pageSize = slideShow.getPageSize();
        writeProperties(slideShow, deck);

        for (SlidePlan plan : plans) {
            XSLFSlide slide = workingCopy.appendSlide(plan.getLayout().getLayout());
            SlideCanvas canvas = new SlideCanvas(slide, plan.getLayout().getLayout(), pageSize);
            try {
                for (ContentBinder binder : binders) {
                    if (binder.supports(plan.getSlide())) {
                        binder.bind(canvas, plan);
                    }
                }
            } catch (DeckGenerationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new DocumentAssemblyException("Failed to compose slide " + plan.getIndex()
                        + " ('" + plan.getSlide().getTitle() + "')", e);
            }
            canvas.removeUnfilled();
            log.debug("Slide {} composed on layout '{}'", plan.getIndex(), plan.getLayout().getLayout().getLayoutName());
        }
        return workingCopy.toBytes();
    }

    private void writeProperties(XMLSlideShow slideShow, SlideDeckSpec deck) {
        POIXMLProperties.CoreProperties core = slideShow.getProperties().getCoreProperties();
        String title = deck.getTitle() != null ? deck.getTitle() : deck.getSlides().get(0).getTitle();
        core.setTitle(title);
        if (deck.getAuthor() != null) {
            core.setCreator(deck.getAuthor());
        }
        if (deck.getSubject() != null) {
            core.setSubjectProperty(deck.getSubject());
        }
        if (deck.getSubtitle() != null) {
            core.setDescription(deck.getSubtitle());
        }
        core.getUnderlyingProperties().setLanguageProperty(deck.getLanguage());
    }
}
