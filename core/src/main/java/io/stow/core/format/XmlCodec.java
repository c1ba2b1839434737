package io.stow.core.format;

import com.fasterxml.jackson.dataformat.xml.XmlMapper;

/**
 * XML documents via Jackson's XML dataformat.
 * The root element is named after the value's class; readers ignore it.
 */
public final class XmlCodec extends JacksonCodec {

    public XmlCodec() {
        this(new XmlMapper());
    }

    public XmlCodec(XmlMapper mapper) {
        super(mapper);
    }
}
