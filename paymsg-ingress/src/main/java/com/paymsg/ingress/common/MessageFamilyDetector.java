package com.paymsg.ingress.common;

import com.paymsg.canonical.enums.MessageFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Detects the message family of an ISO 20022 payload.
 *
 * The namespace URI wins when it names a known family. Otherwise the business
 * root element is checked (the payload root itself, then its first child for
 * the usual Document wrapper). Unknown payloads resolve to
 * {@link MessageFamily#BASE}.
 */
public final class MessageFamilyDetector {

    private static final Logger log = LoggerFactory.getLogger(MessageFamilyDetector.class);

    private MessageFamilyDetector() {
    }

    public static MessageFamily detect(String namespace, Element payloadRoot) {
        Optional<MessageFamily> byNamespace = MessageFamily.fromNamespace(namespace);
        if (byNamespace.isPresent()) {
            log.debug("Detected {} from namespace {}", byNamespace.get().getKey(), namespace);
            return byNamespace.get();
        }
        if (payloadRoot == null) {
            return MessageFamily.BASE;
        }

        String elementName = XmlDocuments.localName(payloadRoot);
        log.debug("Detecting message family from root element: {}", elementName);
        Optional<MessageFamily> byRoot = MessageFamily.fromRootElement(elementName);
        if (byRoot.isPresent()) {
            log.debug("Detected {} from root element", byRoot.get().getKey());
            return byRoot.get();
        }

        Element child = XmlDocuments.firstChildElement(payloadRoot);
        if (child != null) {
            Optional<MessageFamily> byChild = MessageFamily.fromRootElement(XmlDocuments.localName(child));
            if (byChild.isPresent()) {
                log.debug("Detected {} from child element", byChild.get().getKey());
                return byChild.get();
            }
        }

        log.debug("No dedicated family for root element '{}' (namespace {})", elementName, namespace);
        return MessageFamily.BASE;
    }
}
