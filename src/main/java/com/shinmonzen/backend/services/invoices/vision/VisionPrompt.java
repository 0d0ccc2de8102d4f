package com.shinmonzen.backend.services.invoices.vision;

final class VisionPrompt {

    static final String INSTRUCTIONS = """
            You are reading a Japanese vendor invoice or delivery statement for a restaurant.
            Extract every purchased line item from the page images.

            Rules:
            1. Keep item names exactly as printed (Japanese stays Japanese, do not translate).
            2. Dates as yyyy-MM-dd. If a line has no date, use the invoice date.
            3. quantity, unit_price and amount are plain numbers without currency symbols or commas.
            4. unit is the printed unit (kg, g, pc, 本, 缶, 箱, パック ...). Use "pc" if none is printed.
            5. Skip subtotal, tax, shipping and grand total lines.

            Respond with ONLY one JSON object, no explanation:
            {
              "vendor_name": "string",
              "invoice_date": "yyyy-MM-dd",
              "items": [
                {
                  "date": "yyyy-MM-dd",
                  "item_name": "string",
                  "quantity": number,
                  "unit": "string",
                  "unit_price": number,
                  "amount": number
                }
              ]
            }
            """;

    private VisionPrompt() {
    }
}
