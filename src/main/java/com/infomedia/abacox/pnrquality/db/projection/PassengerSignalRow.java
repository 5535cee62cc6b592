package com.infomedia.abacox.pnrquality.db.projection;

import com.infomedia.abacox.pnrquality.component.scoring.PassengerLine;

public interface PassengerSignalRow extends PassengerLine {
}
