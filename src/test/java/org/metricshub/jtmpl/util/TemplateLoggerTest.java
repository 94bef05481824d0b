package org.metricshub.jtmpl.util;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.jtmpl.frontend.TemplateParser;
import org.slf4j.Logger;

public class TemplateLoggerTest {

	@Test
	public void testLoggerIsNamedAfterTheClass() {
		Logger logger = TemplateLogger.getLogger(TemplateParser.class);
		assertEquals(TemplateParser.class.getName(), logger.getName());
	}

	@Test
	public void testInternalVerbosityIsSet() {
		TemplateLogger.getLogger(TemplateLoggerTest.class);
		assertNotNull(System.getProperty(TemplateLogger.VERBOSITY_PROPERTY));
	}
}
