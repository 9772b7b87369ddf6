package com.okazje.scanner.scan.classify;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.model.Listing;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class ListingPromptBuilder {
    private static final String SYSTEM_TEMPLATE = """
        Jesteś ekspertem od wyceny antyków, kolekcji i militariów na polskim rynku wtórnym.
        Oceń ofertę i zarekomenduj zakup albo odrzucenie.

        KONTEKST KUPUJĄCEGO:
        - Profesjonalny reseller: komiksy PRL, porcelana, zegarki vintage, broń biała, malarstwo, książki kolekcjonerskie
        - Maksymalna cena zakupu: %s zł/szt
        - Minimalna wymagana marża: %d%%
        - Odbiór osobisty do 2h drogi, wysyłka mile widziana

        ANALIZA MUSI ZAWIERAĆ:
        1. IDENTYFIKACJA - co to jest, oryginał czy replika, kluczowe cechy.
        2. RED FLAGS - co budzi podejrzenia.
        3. WYCENA RYNKOWA - realistyczny zakres cen dla oryginału, w formacie "od - do zł".
        4. KALKULACJA - cena zakupu a cena sprzedaży, marża w procentach.
        5. WERDYKT - dokładnie jeden z: 🟢 KUP, 🟡 NEGOCJUJ, 🟠 ZBADAJ, ❌ OMIŃ.

        Odpowiadaj zwięźle, maksymalnie 300 słów, po polsku.""";

    private final ScannerProperties.Scan scan;

    public ListingPromptBuilder(ScannerProperties properties) {
        this.scan = properties.getScan();
    }

    public String systemPrompt() {
        return String.format(SYSTEM_TEMPLATE, scan.getMaxPrice().toPlainString(), scan.getMinMarginPercent());
    }

    public String userPrompt(Listing listing) {
        StringBuilder sb = new StringBuilder("Przeanalizuj tę ofertę:\n\n");
        sb.append("TYTUŁ: ").append(listing.title()).append('\n');
        sb.append("CENA: ").append(formatPrice(listing.price())).append(" zł\n");
        sb.append("STAN: ").append(describeCondition(listing.condition())).append('\n');
        sb.append("PLATFORMA: ").append(listing.platform().label()).append('\n');
        sb.append("LOKALIZACJA: ").append(listing.location()).append('\n');
        sb.append("SPRZEDAWCA: ").append(listing.seller()).append('\n');
        sb.append("OPIS: ").append(listing.description()).append('\n');
        sb.append("URL: ").append(listing.url()).append('\n');
        sb.append("LICZBA ZDJĘĆ: ").append(listing.images().size());
        return sb.toString();
    }

    private static String formatPrice(BigDecimal price) {
        return price.stripTrailingZeros().toPlainString();
    }

    private static String describeCondition(String condition) {
        if (condition == null || condition.isBlank() || condition.equals("unknown")) {
            return "nie podano";
        }
        return switch (condition) {
            case "new" -> "nowy";
            case "used" -> "używany";
            default -> condition;
        };
    }
}
