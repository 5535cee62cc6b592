package com.infomedia.abacox.pnrquality.db.projection;

import com.infomedia.abacox.pnrquality.component.scoring.ContactLine;

public interface ContactSignalRow extends ContactLine {
}
