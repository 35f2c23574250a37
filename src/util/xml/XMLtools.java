package util.xml;

import org.tinylog.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.IntStream;

public class XMLtools {

	private XMLtools() {
		throw new IllegalStateException("Utility class");
	}
	/**
	 * Read and parse an XML file to a Document, returning an empty optional on error
	 *
	 * @param xml The path to the file
	 * @return The Document of the XML
	 */
	public static Optional<Document> readXML( Path xml ) {
		if( xml == null ){
			Logger.error("xml -> No path given to read");
			return Optional.empty();
		}
		if(Files.notExists(xml)){
			Logger.error("xml -> No such file: "+xml);
			return Optional.empty();
		}

		var dbfOpt = createDocFactory();
		if( dbfOpt.isEmpty())
			return Optional.empty();

		try {
			Document doc = dbfOpt.get().newDocumentBuilder().parse(xml.toFile());
			doc.getDocumentElement().normalize();
			return Optional.of(doc);
		} catch (ParserConfigurationException | SAXException | IOException e) {
			Logger.error("xml -> Error occurred while reading " + xml + ": " + e.getMessage());
			return Optional.empty();
		}
	}
	/**
	 * Create a factory that refuses doctypes and external entities
	 * @return The factory or an empty optional if the features couldn't be set
	 */
	private static Optional<DocumentBuilderFactory> createDocFactory(){
		DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
		dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
		dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

		try {
			dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
			dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
			dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
		} catch (ParserConfigurationException e) {
			Logger.error("xml -> Failed to configure the parser: " + e.getMessage());
			return Optional.empty();
		}
		return Optional.of(dbf);
	}
	/**
	 * Get the first child element of the given element with the given tag, case-insensitive
	 *
	 * @param element The element to look in
	 * @param tag The tag to look for, * matches any
	 * @return The child or an empty optional if none was found
	 */
	public static Optional<Element> getFirstChildByTag(Element element, String tag) {
		if( element == null || tag == null ){
			Logger.error("xml -> Element or tag is null when looking for a child");
			return Optional.empty();
		}
		var list = element.getChildNodes();
		return IntStream.range(0, list.getLength())
				.mapToObj(list::item)
				.filter(Element.class::isInstance)
				.map(Element.class::cast)
				.filter(ele -> tag.equals("*") || ele.getTagName().equalsIgnoreCase(tag))
				.findFirst();
	}
}
