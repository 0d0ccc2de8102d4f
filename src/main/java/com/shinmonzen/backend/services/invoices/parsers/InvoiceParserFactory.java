package com.shinmonzen.backend.services.invoices.parsers;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;

@Component
public class InvoiceParserFactory {

    private final Map<ExtractionStrategy, InvoiceParserStrategy> parsers = new EnumMap<>(ExtractionStrategy.class);

    public InvoiceParserFactory(ExtractionProperties properties, Clock clock) {
        register(List.of(
                new HirayamaInvoiceParser(properties),
                new FrenchFnbInvoiceParser(properties),
                new MaruyataInvoiceParser(clock)));
    }

    private void register(List<InvoiceParserStrategy> strategies) {
        for (InvoiceParserStrategy s : strategies) {
            parsers.put(s.strategy(), s);
        }
    }

    public Optional<InvoiceParserStrategy> getParser(ExtractionStrategy strategy) {
        if (strategy == null) return Optional.empty();
        return Optional.ofNullable(parsers.get(strategy));
    }
}
