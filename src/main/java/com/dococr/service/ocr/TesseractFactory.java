package com.dococr.service.ocr;

import net.sourceforge.tess4j.ITesseract;

/**
 * Creates a fresh, unconfigured Tess4J instance. Instances are not thread-safe, so one is
 * created for every recognition call.
 */
@FunctionalInterface
public interface TesseractFactory {

    ITesseract create();
}
